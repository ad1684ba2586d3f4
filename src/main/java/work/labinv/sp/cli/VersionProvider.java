package work.labinv.sp.cli;

import java.util.TreeSet;
import picocli.CommandLine;
import work.labinv.sp.api.SetupParamTypes;

/**
 * {@code --version}: build version from the jar manifest plus the setup-parameter types this build can calculate.
 */
final class VersionProvider implements CommandLine.IVersionProvider {
    static final String UNPACKAGED = "development";

    @Override
    public String[] getVersion() {
        var registry = SetupParamTypes.create();
        var pending = new TreeSet<>(registry.declaredTypes());
        pending.removeAll(registry.supportedTypes());
        return new String[] {
            "labinv-sp " + version(),
            "Setup parameter types: " + String.join(", ", registry.supportedTypes()),
            "Declared, not yet supported: " + (pending.isEmpty() ? "none" : String.join(", ", pending))
        };
    }

    static String version() {
        String implementationVersion = VersionProvider.class.getPackage().getImplementationVersion();
        return implementationVersion == null || implementationVersion.isBlank() ? UNPACKAGED : implementationVersion;
    }
}
