package work.labinv.sp.api;

import java.time.Clock;
import work.labinv.sp.dar8.Dar8SetupParam;

/**
 * Shared registry bootstrap so the CLI, the runner and tests see the same set of types.
 */
public final class SetupParamTypes {
    public static final String DAR8 = "DAR8";
    public static final String DAR4 = "DAR4";
    public static final String DEBLOCKING = "DEBLOCKING";
    public static final String THIOMAB = "THIOMAB";

    private SetupParamTypes() {}

    public static SetupParamTypeRegistry create() {
        return create(Clock.systemDefaultZone());
    }

    public static SetupParamTypeRegistry create(Clock clock) {
        return new SetupParamTypeRegistry(clock)
            .register(new Dar8SetupParam())
            .declare(DAR4)
            .declare(DEBLOCKING)
            .declare(THIOMAB);
    }
}
