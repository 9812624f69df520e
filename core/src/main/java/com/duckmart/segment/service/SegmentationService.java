package com.duckmart.segment.service;

import com.duckmart.segment.config.SegmentationConfig;
import com.duckmart.segment.exception.ConfigurationException;
import com.duckmart.segment.exception.QueryExecutionException;
import com.duckmart.segment.exception.ValidationException;
import com.duckmart.segment.filter.SegmentationRequest;
import com.duckmart.segment.filter.ValidatedRequest;
import com.duckmart.segment.generator.SegmentQuery;
import com.duckmart.segment.generator.SegmentQueryAssembler;
import com.duckmart.segment.runtime.DuckDBConnectionManager;
import com.duckmart.segment.runtime.SegmentExecutor;
import com.duckmart.segment.runtime.SegmentResult;
import com.duckmart.segment.validation.RequestValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Entry point for segmentation: validate, assemble, execute.
 *
 * <p>The service holds no per-request state and is safe to share between
 * threads; each call borrows its own pooled connection.
 *
 * <p>Example usage:
 * <pre>
 *   SegmentationService service = new SegmentationService(SegmentationConfig.defaults(), manager);
 *   SegmentationResponse response = service.segment(SegmentationRequest.builder()
 *       .userFilter(UserFilter.of("subscription_plan", "eq", "Premium"))
 *       .eventFilter(EventFilter.within("PURCHASE_MADE", "gte", 1, 30))
 *       .build());
 * </pre>
 */
public class SegmentationService {

    private static final Logger logger = LoggerFactory.getLogger(SegmentationService.class);

    private final SegmentationConfig config;
    private final RequestValidator validator;
    private final SegmentQueryAssembler assembler;
    private final SegmentExecutor executor;

    public SegmentationService(SegmentationConfig config, DuckDBConnectionManager connectionManager) {
        this(config, new SegmentExecutor(connectionManager));
    }

    public SegmentationService(SegmentationConfig config, SegmentExecutor executor) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.validator = new RequestValidator(config);
        this.assembler = new SegmentQueryAssembler(config);
    }

    /**
     * Selects the users matching a request.
     *
     * @param request the request as received
     * @return the matching identities and the normalized request
     * @throws ValidationException if the request is invalid; nothing reaches the database
     * @throws ConfigurationException if the request refers to a column the schema lacks
     * @throws QueryExecutionException if the statement cannot be executed
     */
    public SegmentationResponse segment(SegmentationRequest request) {
        ValidatedRequest validated = validator.validate(request);
        if (validated.limitClamped()) {
            logger.debug("Limit {} clamped to {}", validated.requestedLimit(), validated.limit());
        }

        SegmentQuery query = assembler.assemble(validated);
        logger.debug("Segment SQL:\n{}\nparameters: {}", query.sql(), query.parameters());

        SegmentResult result = executor.execute(query);
        logger.info("Segment matched {} users ({} attribute filters, {} event filters, {})",
            result.count(), validated.attributePredicates().size(),
            validated.eventPredicates().size(), validated.logicOperator());

        return new SegmentationResponse(result.userIds(), result.count(), validated, result.rows());
    }

    /**
     * Validates and compiles a request without executing it.
     *
     * @param request the request as received
     * @return the statement that {@link #segment} would run
     * @throws ValidationException if the request is invalid
     */
    public SegmentQuery explain(SegmentationRequest request) {
        return assembler.assemble(validator.validate(request));
    }

    public SegmentationConfig getConfig() {
        return config;
    }
}
