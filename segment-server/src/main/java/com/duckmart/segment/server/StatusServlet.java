package com.duckmart.segment.server;

import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import java.io.IOException;

/**
 * GET / and GET /health: a fixed one-key JSON object.
 *
 * <p>Mounted on "/" it also catches unmapped paths, which get a 404.
 */
public final class StatusServlet extends HttpServlet {

    static final String BANNER = "DuckMart User Segmentation API";

    private final SegmentationJson json;
    private final String key;
    private final String value;
    private final boolean rootOnly;

    private StatusServlet(SegmentationJson json, String key, String value, boolean rootOnly) {
        this.json = json;
        this.key = key;
        this.value = value;
        this.rootOnly = rootOnly;
    }

    public static StatusServlet root(SegmentationJson json) {
        return new StatusServlet(json, "message", BANNER, true);
    }

    public static StatusServlet health(SegmentationJson json) {
        return new StatusServlet(json, "status", "healthy", false);
    }

    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        ObjectNode node;
        if (rootOnly && !isRoot(req)) {
            resp.setStatus(HttpServletResponse.SC_NOT_FOUND);
            node = json.error("not_found", "No route for " + req.getRequestURI());
        } else {
            resp.setStatus(HttpServletResponse.SC_OK);
            node = json.mapper().createObjectNode().put(key, value);
        }
        resp.setContentType("application/json");
        resp.setCharacterEncoding("UTF-8");
        resp.getWriter().write(json.write(node));
    }

    private static boolean isRoot(HttpServletRequest req) {
        String path = req.getServletPath() + (req.getPathInfo() != null ? req.getPathInfo() : "");
        return path.isEmpty() || path.equals("/");
    }
}
