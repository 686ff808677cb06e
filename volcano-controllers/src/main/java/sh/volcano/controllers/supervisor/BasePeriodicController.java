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

package sh.volcano.controllers.supervisor;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;

import com.google.common.annotations.VisibleForTesting;
import com.netflix.spectator.api.Gauge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.volcano.common.runtime.VolcanoRuntime;
import sh.volcano.common.util.concurrent.StopSignal;
import sh.volcano.common.util.limiter.Limiters;
import sh.volcano.common.util.limiter.tokenbucket.TokenBucket;

/**
 * Base class for controllers that reconcile a snapshot of the informer caches at a fixed interval. At most
 * {@code batchSize} items are processed per interval; the remaining ones are picked up by the next iterations.
 */
public abstract class BasePeriodicController<T> implements Controller {

    private static final Logger logger = LoggerFactory.getLogger(BasePeriodicController.class);

    private static final String METRIC_ROOT = "volcano.controllers.";

    protected final String name;
    protected final VolcanoRuntime runtime;
    protected final long intervalMs;

    private final TokenBucket tokenBucket;

    private final Gauge skippedGauge;
    private final Gauge successesGauge;
    private final Gauge failuresGauge;

    protected BasePeriodicController(String name, long intervalMs, int batchSize, VolcanoRuntime runtime) {
        this.name = name;
        this.runtime = runtime;
        this.intervalMs = intervalMs;
        this.tokenBucket = Limiters.createFixedIntervalTokenBucket(
                name + "TokenBucket",
                batchSize,
                batchSize,
                batchSize,
                intervalMs,
                TimeUnit.MILLISECONDS,
                runtime.getClock()
        );

        String metricRoot = METRIC_ROOT + name;
        this.skippedGauge = runtime.getRegistry().gauge(metricRoot, "type", "skipped");
        this.successesGauge = runtime.getRegistry().gauge(metricRoot, "type", "successes");
        this.failuresGauge = runtime.getRegistry().gauge(metricRoot, "type", "failures");
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public void run(StopSignal stopSignal) throws Exception {
        while (!stopSignal.isStopped()) {
            try {
                runIteration();
            } catch (Exception e) {
                logger.error("[{}] Iteration failed", name, e);
            }
            stopSignal.await(Duration.ofMillis(intervalMs));
        }
        resetGauges();
    }

    @VisibleForTesting
    public void runIteration() {
        if (!isReady()) {
            logger.info("[{}] Skipping iteration, as the informer caches are not synced yet", name);
            resetGauges();
            return;
        }

        List<T> allItems = Collections.emptyList();
        try {
            allItems = getItemsToProcess();
        } catch (Exception e) {
            logger.error("[{}] Unable to get items to process", name, e);
        }

        int total = allItems.size();
        int limited = (int) Math.min(total, tokenBucket.getNumberOfTokens());
        int skipped = total - limited;
        int successes = 0;
        int failures = 0;

        if (limited > 0 && tokenBucket.tryTake(limited)) {
            for (T item : allItems.subList(0, limited)) {
                try {
                    if (processItem(item)) {
                        successes++;
                    } else {
                        failures++;
                    }
                } catch (Exception e) {
                    failures++;
                    logger.error("[{}] Unable to process item: {}", name, describe(item), e);
                }
            }
        }

        skippedGauge.set(skipped);
        successesGauge.set(successes);
        failuresGauge.set(failures);
        if (total > 0) {
            logger.info("[{}] Finished iteration: total={}, skipped={}, successes={}, failures={}",
                    name, total, skipped, successes, failures);
        }
    }

    /**
     * @return false if the data the controller works on is not available yet
     */
    protected abstract boolean isReady();

    protected abstract List<T> getItemsToProcess();

    /**
     * @return true on success, false if the item could not be processed, and should be retried later
     */
    protected abstract boolean processItem(T item);

    protected String describe(T item) {
        return String.valueOf(item);
    }

    private void resetGauges() {
        skippedGauge.set(0);
        successesGauge.set(0);
        failuresGauge.set(0);
    }
}
