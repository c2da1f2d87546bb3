package com.launchpad.server;

import com.launchpad.api.graphql.Graphlette;
import com.launchpad.auth.token.TokenAuth;
import com.launchpad.core.*;
import com.launchpad.core.config.GraphletteConfig;
import com.launchpad.core.config.StorageConfig;
import jakarta.servlet.*;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.eclipse.jetty.servlet.ServletContextHandler;
import org.eclipse.jetty.servlet.ServletHolder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.LinkedHashSet;
import java.util.Map;

public class Server {
    private static final Logger logger = LoggerFactory.getLogger(Server.class);
    private final Map<String, Plugin> plugins;
    private final Auth auth;
    private org.eclipse.jetty.server.Server jettyServer;

    public Server(Map<String, Plugin> plugins) {
        this(plugins, new TokenAuth());
    }

    public Server(Map<String, Plugin> plugins, Auth auth) {
        this.plugins = plugins;
        this.auth = auth;
    }

    public void init(Config config) throws Exception {
        jettyServer = new org.eclipse.jetty.server.Server(config.port());

        ServletContextHandler context = new ServletContextHandler(ServletContextHandler.SESSIONS);
        context.setContextPath("/");
        jettyServer.setHandler(context);

        context.addFilter(CORSFilter.class, "/*", null);

        context.addServlet(new ServletHolder(new HealthCheckServlet()), "/health");
        context.addServlet(new ServletHolder(new HealthCheckServlet()), "/ready");

        if (config.graphlettes() != null) {
            for (GraphletteConfig graphletteConfig : config.graphlettes()) {
                try {
                    processGraphlette(context, graphletteConfig);
                    logger.info("Initialized Graphlette at path: {}", graphletteConfig.path());
                } catch (Exception e) {
                    logger.error("Failed to initialize Graphlette at path: {}", graphletteConfig.path(), e);
                }
            }
        }

        jettyServer.start();
        logger.info("Server initialized on port {}", config.port());
    }

    private void processGraphlette(ServletContextHandler context, GraphletteConfig config) {
        CatalogSource catalog = plugin(config.catalog()).createCatalog(config.catalog());
        IdentitySource identity = plugin(config.identity()).createIdentity(config.identity());

        Graphlette graphlette = new Graphlette(auth, catalog, identity);
        context.addServlet(new ServletHolder(graphlette), config.path());
    }

    private Plugin plugin(StorageConfig storage) {
        Plugin plugin = plugins.get(storage.type);
        if (plugin == null) {
            throw new IllegalArgumentException("Plugin for storage type " + storage.type + " not found");
        }
        return plugin;
    }

    public void stop() throws Exception {
        logger.info("Stopping server");

        if (jettyServer != null) {
            jettyServer.stop();
            jettyServer.join();
        }

        // One plugin may be registered under several names
        for (Plugin plugin : new LinkedHashSet<>(plugins.values())) {
            try {
                plugin.cleanUp();
            } catch (Exception e) {
                logger.error("Error cleaning up plugin", e);
            }
        }
    }

    /**
     * CORS filter to allow cross-origin requests
     */
    public static class CORSFilter implements Filter {
        @Override
        public void init(FilterConfig filterConfig) throws ServletException {
        }

        @Override
        public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
                throws IOException, ServletException {
            HttpServletResponse httpResponse = (HttpServletResponse) response;
            httpResponse.setHeader("Access-Control-Allow-Origin", "*");
            httpResponse.setHeader("Access-Control-Allow-Methods", "GET, POST, OPTIONS");
            httpResponse.setHeader("Access-Control-Allow-Headers", "Content-Type, Authorization");

            HttpServletRequest httpRequest = (HttpServletRequest) request;
            if ("OPTIONS".equalsIgnoreCase(httpRequest.getMethod())) {
                httpResponse.setStatus(HttpServletResponse.SC_OK);
                return;
            }

            chain.doFilter(request, response);
        }

        @Override
        public void destroy() {
        }
    }

    public static class HealthCheckServlet extends jakarta.servlet.http.HttpServlet {
        @Override
        protected void doGet(HttpServletRequest request, HttpServletResponse response)
                throws ServletException, IOException {
            response.setContentType("application/json");
            response.setStatus(HttpServletResponse.SC_OK);
            response.getWriter().write("{\"status\":\"ok\"}");
        }
    }
}
