package io.fabflow.core.flow;

import java.util.logging.Level;
import java.util.logging.Logger;

/// {@link FlowObserver} writing planning progress to `java.util.logging`.
///
/// State transitions are logged at `FINE`, emitted and skipped steps at `INFO`, failures at
/// `WARNING`.
public final class LoggingFlowObserver implements FlowObserver {

    private static final Logger logger = Logger.getLogger(LoggingFlowObserver.class.getName());

    @Override
    public void onEvent(FlowEvent event) {
        if (event instanceof FlowEvent.StateEntered entered) {
            String change =
                    entered.orderIndex() >= 0 ? " (change " + entered.orderIndex() + ")" : "";
            logger.fine("[" + entered.flowId() + "] " + entered.state() + change);
        } else if (event instanceof FlowEvent.StepEmitted emitted) {
            logger.info(
                    "[" + emitted.flowId() + "] Step " + emitted.step().stepNumber() + ": "
                            + emitted.step().processType() + " on " + emitted.step().toolId());
        } else if (event instanceof FlowEvent.StepSkipped skipped) {
            logger.info("[" + skipped.flowId() + "] Skipped " + skipped.diagnostic());
        } else if (event instanceof FlowEvent.FlowCompleted completed) {
            logger.info(
                    "[" + completed.flowId() + "] Flow complete: "
                            + completed.result().flow().size() + " steps, "
                            + completed.result().diagnostics().size() + " diagnostics");
        } else if (event instanceof FlowEvent.FlowFailed failed) {
            logger.log(
                    Level.WARNING,
                    "[" + failed.flowId() + "] Flow failed at change " + failed.orderIndex() + ": "
                            + failed.error().getMessage());
        }
    }
}
