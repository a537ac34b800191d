package work.lcod.settings.cli;

import picocli.CommandLine;
import work.lcod.settings.api.SettingsRegistry;

/**
 * Reports the library version and the validation engines {@code --engine} accepts.
 */
final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        String implementationVersion = SettingsRegistry.class.getPackage().getImplementationVersion();
        return new String[] {
            "lcod-settings " + (implementationVersion != null ? implementationVersion : "development"),
            "validation engines: " + String.join(", ", SettingsCheckCommand.ENGINES),
            "java " + Runtime.version().feature()
        };
    }
}
