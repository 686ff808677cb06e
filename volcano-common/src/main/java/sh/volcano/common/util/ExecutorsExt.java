/*
 * Copyright 2019 The Volcano Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package sh.volcano.common.util;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.netflix.spectator.api.Registry;
import com.netflix.spectator.api.patterns.ThreadPoolMonitor;

/**
 * Executors of the controller processes. All threads are daemons, so a controller that fails to stop its executor
 * never keeps the process alive.
 */
public final class ExecutorsExt {

    private ExecutorsExt() {
    }

    /**
     * Single thread executor, with the thread named exactly as given. Used for the work queue and election loops.
     */
    public static ExecutorService namedSingleThreadExecutor(String name) {
        return newThreadPool(1, 1, 0, new LinkedBlockingQueue<>(), daemonThreadFactory(name));
    }

    /**
     * Unbounded pool whose idle threads exit after a minute. Used by the Kubernetes client and its informers.
     */
    public static ExecutorService instrumentedCachedThreadPool(Registry registry, String name) {
        return instrument(registry, name, newThreadPool(0, Integer.MAX_VALUE, 60_000, new SynchronousQueue<>(), numberedDaemonThreadFactory(name)));
    }

    /**
     * Pool of {@code size} workers sharing an unbounded task queue.
     */
    public static ExecutorService instrumentedFixedSizeThreadPool(Registry registry, String name, int size) {
        return instrument(registry, name, newThreadPool(size, size, 0, new LinkedBlockingQueue<>(), numberedDaemonThreadFactory(name)));
    }

    private static ThreadPoolExecutor newThreadPool(int coreSize,
                                                    int maxSize,
                                                    long keepAliveMs,
                                                    BlockingQueue<Runnable> queue,
                                                    ThreadFactory threadFactory) {
        return new ThreadPoolExecutor(coreSize, maxSize, keepAliveMs, TimeUnit.MILLISECONDS, queue, threadFactory);
    }

    private static ExecutorService instrument(Registry registry, String name, ThreadPoolExecutor executor) {
        ThreadPoolMonitor.attach(registry, executor, name);
        return executor;
    }

    private static ThreadFactory daemonThreadFactory(String name) {
        return new ThreadFactoryBuilder().setNameFormat(name).setDaemon(true).build();
    }

    private static ThreadFactory numberedDaemonThreadFactory(String name) {
        return new ThreadFactoryBuilder().setNameFormat(name + "-%d").setDaemon(true).build();
    }
}
