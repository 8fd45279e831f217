package com.example.votequorum.handler;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.LambdaLogger;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.example.votequorum.config.ConsensusConfig;
import com.example.votequorum.exception.ConsensusException;
import com.example.votequorum.logging.PerformanceTracker;
import com.example.votequorum.logging.StructuredLogger;
import com.example.votequorum.messaging.AsyncNotificationDispatcher;
import com.example.votequorum.messaging.SqsNotificationSink;
import com.example.votequorum.model.CastVoteReceipt;
import com.example.votequorum.model.Election;
import com.example.votequorum.model.ElectionStats;
import com.example.votequorum.model.NodeSummary;
import com.example.votequorum.model.RequestType;
import com.example.votequorum.model.VoteRequest;
import com.example.votequorum.model.VoteResponse;
import com.example.votequorum.model.VoteStatusView;
import com.example.votequorum.service.VoteConsensusService;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * AWS Lambda handler exposing the vote consensus service.
 * Routes each request by type; every failure becomes an unsuccessful response carrying the
 * exception's simple name as error type.
 */
public class VoteLambdaHandler implements RequestHandler<VoteRequest, VoteResponse> {

    private final VoteConsensusService service;
    private final String coordinatorId;
    private final StructuredLogger structuredLogger;
    private final PerformanceTracker performanceTracker;
    private final AsyncNotificationDispatcher dispatcher;
    private final SqsNotificationSink sqsSink;
    private final AtomicBoolean isShuttingDown = new AtomicBoolean(false);

    /**
     * Constructor for dependency injection.
     * Used primarily for testing with a prepared service.
     */
    public VoteLambdaHandler(VoteConsensusService service) {
        this.service = service;
        this.coordinatorId = service.getConfig().getCoordinatorId();
        this.structuredLogger = new StructuredLogger(VoteLambdaHandler.class, coordinatorId);
        this.performanceTracker = new PerformanceTracker(structuredLogger);
        this.dispatcher = null;
        this.sqsSink = null;
    }

    /**
     * Default constructor for Lambda runtime.
     * Builds the service from environment configuration and publishes notifications to SQS.
     */
    public VoteLambdaHandler() {
        ConsensusConfig config = ConsensusConfig.fromEnvironment();
        this.coordinatorId = config.getCoordinatorId();
        this.structuredLogger = new StructuredLogger(VoteLambdaHandler.class, coordinatorId);
        this.performanceTracker = new PerformanceTracker(structuredLogger);

        structuredLogger.logServiceLifecycle(StructuredLogger.ServiceLifecycleEvent.STARTING,
            Map.of("coordinatorId", coordinatorId));

        this.sqsSink = SqsNotificationSink.fromConfig(config);
        this.dispatcher = new AsyncNotificationDispatcher(sqsSink, coordinatorId);
        this.service = VoteConsensusService.create(config, dispatcher);
        this.service.start();

        Runtime.getRuntime().addShutdownHook(new Thread(this::performGracefulShutdown));
    }

    @Override
    public VoteResponse handleRequest(VoteRequest request, Context context) {
        LambdaLogger logger = context.getLogger();
        PerformanceTracker.OperationTimer timer = null;

        try {
            if (request == null) {
                logger.log("Processing null request");
                structuredLogger.logError("handleRequest", "Invalid request: request is null", null, 0, 0, Map.of());
                return createErrorResponse("Invalid request: request is null", null);
            }
            if (request.getType() == null) {
                logger.log("Processing request with null type");
                structuredLogger.logError("handleRequest", "Invalid request: missing type", null, 0, 0, Map.of());
                return createErrorResponse("Invalid request: missing type", null);
            }

            String subject = request.getVoteId() != null ? request.getVoteId() : String.valueOf(request.getElectionId());
            timer = performanceTracker.startOperation(subject, request.getType().toString());
            structuredLogger.setMDCContext(request.getVoteId(), request.getType().toString());

            logger.log(String.format("Processing request: type=%s, election=%s, vote=%s, node=%s",
                request.getType(), request.getElectionId(), request.getVoteId(), request.getNodeId()));

            VoteResponse response = routeRequest(request);
            performanceTracker.recordOperation(timer, true, null);

            logger.log(String.format("Request processed: success=%s, message=%s",
                response.isSuccess(), response.getMessage()));
            return response;

        } catch (ConsensusException | IllegalArgumentException e) {
            logger.log("Request rejected: " + e.getMessage());
            recordFailure(timer, e);
            return createErrorResponse(e.getMessage(), e);
        } catch (Exception e) {
            logger.log("Error processing request: " + e.getMessage());
            structuredLogger.logError("handleRequest", "Internal error processing request", e, 0, 0,
                Map.of("requestType", request.getType() != null ? request.getType().toString() : "unknown"));
            recordFailure(timer, e);
            return createErrorResponse("Internal error: " + e.getMessage(), e);
        } finally {
            structuredLogger.clearMDCContext();
        }
    }

    private VoteResponse routeRequest(VoteRequest request) {
        RequestType type = request.getType();
        switch (type) {
            case SETUP_ELECTION: {
                Election election = service.setupElection(require(request.getElectionId(), "electionId"),
                    request.getElectionName(), request.getReplicationFactor());
                return success("Election set up with " + election.getReplicationFactor() + " nodes", election);
            }
            case START_ELECTION: {
                Election election = service.startElection(require(request.getElectionId(), "electionId"));
                return success("Election started", election);
            }
            case END_ELECTION: {
                ElectionStats stats = service.endElection(require(request.getElectionId(), "electionId"));
                return success("Election ended", stats);
            }
            case CAST_VOTE: {
                CastVoteReceipt receipt = service.castVote(
                    require(request.getVoterId(), "voterId"),
                    require(request.getCandidateId(), "candidateId"),
                    require(request.getElectionId(), "electionId"));
                return success(receipt.getMessage(), receipt);
            }
            case CONFIRM: {
                if (request.getOutcome() == null) {
                    throw new IllegalArgumentException("Missing required field: outcome");
                }
                boolean recorded = service.recordConfirmation(require(request.getVoteId(), "voteId"),
                    require(request.getNodeId(), "nodeId"), request.getOutcome());
                Map<String, Object> data = new HashMap<>();
                data.put("recorded", recorded);
                return new VoteResponse(recorded,
                    recorded ? "Confirmation recorded" : "Confirmation dropped: no pending entry for this node",
                    coordinatorId, recorded ? null : "UnknownRoundEntryException", data);
            }
            case HEARTBEAT: {
                if (request.getResponseTimeMs() == null) {
                    throw new IllegalArgumentException("Missing required field: responseTimeMs");
                }
                NodeSummary node = service.recordHeartbeat(require(request.getNodeId(), "nodeId"),
                    request.getResponseTimeMs());
                return success("Heartbeat recorded", node);
            }
            case VOTE_STATUS: {
                VoteStatusView view = service.getVoteStatus(require(request.getVoteId(), "voteId"));
                return success("Vote is " + view.getStatus(), view);
            }
            case NODE_STATUSES: {
                List<NodeSummary> nodes = service.getElectionNodeStatuses(require(request.getElectionId(), "electionId"));
                return success(nodes.size() + " nodes", nodes);
            }
            case ELECTION_STATS: {
                ElectionStats stats = service.getElectionStats(require(request.getElectionId(), "electionId"));
                return success("Election statistics", stats);
            }
            case OVERALL_STATS:
                return success("Overall statistics", service.getOverallStats());
            default:
                throw new IllegalArgumentException("Unknown request type: " + type);
        }
    }

    private static String require(String value, String field) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException("Missing required field: " + field);
        }
        return value;
    }

    private VoteResponse success(String message, Object data) {
        return new VoteResponse(true, message, coordinatorId, null, data);
    }

    private VoteResponse createErrorResponse(String message, Exception exception) {
        return new VoteResponse(false, message, coordinatorId,
            exception != null ? exception.getClass().getSimpleName() : null, null);
    }

    private void recordFailure(PerformanceTracker.OperationTimer timer, Exception e) {
        if (timer != null) {
            performanceTracker.recordOperation(timer, false, Map.of("errorType", e.getClass().getSimpleName()));
        }
    }

    private void performGracefulShutdown() {
        if (isShuttingDown.compareAndSet(false, true)) {
            try {
                service.shutdown();
                if (dispatcher != null) {
                    dispatcher.shutdown();
                }
                if (sqsSink != null) {
                    sqsSink.close();
                }
            } catch (RuntimeException e) {
                structuredLogger.logError("performGracefulShutdown", "Error during shutdown", e, 0, 0,
                    Map.of("coordinatorId", coordinatorId));
            }
        }
    }

    public boolean isShuttingDown() {
        return isShuttingDown.get();
    }

    /**
     * Manually triggers graceful shutdown.
     */
    public void shutdown() {
        performGracefulShutdown();
    }
}
