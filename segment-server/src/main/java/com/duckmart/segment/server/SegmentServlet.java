package com.duckmart.segment.server;

import com.duckmart.segment.exception.ConfigurationException;
import com.duckmart.segment.exception.QueryExecutionException;
import com.duckmart.segment.exception.ValidationException;
import com.duckmart.segment.filter.SegmentationRequest;
import com.duckmart.segment.service.SegmentationResponse;
import com.duckmart.segment.service.SegmentationService;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * POST /segment: runs a segmentation request.
 *
 * <p>Status mapping:
 * <ul>
 *   <li>200 with {@code {user_ids, total_count, filters_applied[, users]}}</li>
 *   <li>400 for unreadable bodies and rejected filters</li>
 *   <li>500 for schema inconsistencies and storage failures</li>
 * </ul>
 */
public final class SegmentServlet extends HttpServlet {

    private static final Logger logger = LoggerFactory.getLogger(SegmentServlet.class);

    private final SegmentationService service;
    private final SegmentationJson json;

    public SegmentServlet(SegmentationService service, SegmentationJson json) {
        this.service = service;
        this.json = json;
    }

    @Override
    protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        try {
            SegmentationRequest request = json.readRequest(req.getInputStream());
            SegmentationResponse response = service.segment(request);
            send(resp, HttpServletResponse.SC_OK, json.writeResponse(response));

        } catch (MalformedRequestException e) {
            logger.debug("Malformed segment request: {}", e.getMessage());
            send(resp, HttpServletResponse.SC_BAD_REQUEST, json.writeMalformedRequest(e));

        } catch (ValidationException e) {
            logger.debug("Rejected segment request: {}", e.getMessage());
            send(resp, HttpServletResponse.SC_BAD_REQUEST, json.writeValidationError(e));

        } catch (ConfigurationException e) {
            logger.error("Segment schema inconsistency", e);
            send(resp, HttpServletResponse.SC_INTERNAL_SERVER_ERROR,
                json.error("configuration_error", "Segment query could not be compiled."));

        } catch (QueryExecutionException e) {
            logger.error("Segment query failed: {}", e.getTechnicalMessage(), e);
            send(resp, HttpServletResponse.SC_INTERNAL_SERVER_ERROR,
                json.error("query_execution_error", e.getUserMessage()));
        }
    }

    private void send(HttpServletResponse resp, int status, JsonNode body) throws IOException {
        resp.setStatus(status);
        resp.setContentType("application/json");
        resp.setCharacterEncoding("UTF-8");
        resp.getWriter().write(json.write(body));
    }
}
