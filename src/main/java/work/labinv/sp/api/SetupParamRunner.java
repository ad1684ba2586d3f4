package work.labinv.sp.api;

import java.time.Instant;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.labinv.sp.report.ResultView;

/**
 * Public entry point for embedding the calculator: resolve the type, normalize the request, calculate, wrap.
 * An unsupported type is reported as a status instead of an exception so a session can carry on.
 */
public final class SetupParamRunner {
    private static final Logger LOG = LoggerFactory.getLogger(SetupParamRunner.class);

    private final SetupParamTypeRegistry registry;

    public SetupParamRunner() {
        this(SetupParamTypes.create());
    }

    public SetupParamRunner(SetupParamTypeRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public RunResult run(SetupParamRunConfiguration configuration) {
        var started = Instant.now();
        String typeName = configuration.typeName();
        try {
            var type = registry.resolve(typeName).withClock(configuration.clock());
            var result = type.calculateFromRequest(configuration.requestRecord(), configuration.operatorInputs());
            return RunResult.success(type.name(), new ResultView(result, configuration.display()), started);
        } catch (UnsupportedSetupParamTypeException ex) {
            return RunResult.unsupported(ex.typeName(), ex.getMessage(), started);
        } catch (RuntimeException ex) {
            LOG.error("Setup parameter calculation for {} failed", typeName, ex);
            String message = ex.getMessage() != null && !ex.getMessage().isBlank()
                ? ex.getMessage()
                : ex.getClass().getSimpleName();
            return RunResult.failure(typeName, message, started);
        }
    }
}
