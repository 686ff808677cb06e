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

package sh.volcano.controllers.health;

import java.io.IOException;
import java.net.InetSocketAddress;
import javax.inject.Inject;
import javax.inject.Singleton;
import javax.servlet.http.HttpServlet;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;

import com.google.common.base.Preconditions;
import com.google.common.net.HostAndPort;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.servlet.ServletContextHandler;
import org.eclipse.jetty.servlet.ServletHolder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.volcano.controllers.ControllersConfiguration;

/**
 * Liveness endpoint ({@code GET /healthz}) of the controller manager process. It reports the process state only,
 * independently of the leadership.
 */
@Singleton
public class HealthzServer {

    private static final Logger logger = LoggerFactory.getLogger(HealthzServer.class);

    public static final String HEALTHZ_PATH = "/healthz";

    private final String bindAddress;

    private Server server;

    @Inject
    public HealthzServer(ControllersConfiguration configuration) {
        this(configuration.getHealthzBindAddress());
    }

    public HealthzServer(String bindAddress) {
        this.bindAddress = bindAddress;
    }

    /**
     * @throws IllegalArgumentException if the bind address is not a valid host:port value
     * @throws Exception                if the server cannot bind to the address
     */
    public synchronized void start() throws Exception {
        Preconditions.checkState(server == null, "Healthz server already started");

        HostAndPort hostAndPort = HostAndPort.fromString(bindAddress);
        Preconditions.checkArgument(hostAndPort.hasPort(), "Port not set in healthz bind address: %s", bindAddress);

        ServletContextHandler context = new ServletContextHandler(ServletContextHandler.NO_SESSIONS);
        context.setContextPath("/");
        context.addServlet(new ServletHolder(new HealthzServlet()), HEALTHZ_PATH);

        Server newServer = new Server(new InetSocketAddress(hostAndPort.getHost(), hostAndPort.getPort()));
        newServer.setHandler(context);
        try {
            newServer.start();
        } catch (Exception e) {
            newServer.stop();
            throw e;
        }
        this.server = newServer;
        logger.info("Healthz server listening on {}", bindAddress);
    }

    /**
     * @return the port the server listens on, or -1 if it is not running
     */
    public synchronized int getPort() {
        if (server == null) {
            return -1;
        }
        return ((ServerConnector) server.getConnectors()[0]).getLocalPort();
    }

    public synchronized void stop() {
        if (server == null) {
            return;
        }
        try {
            server.stop();
        } catch (Exception e) {
            logger.warn("Error during healthz server shutdown", e);
        }
        server = null;
    }

    private static class HealthzServlet extends HttpServlet {
        @Override
        protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
            resp.setStatus(HttpServletResponse.SC_OK);
            resp.setContentType("text/plain");
            resp.getWriter().write("ok");
        }
    }
}
