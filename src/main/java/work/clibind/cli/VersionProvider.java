package work.clibind.cli;

import picocli.CommandLine;

/**
 * Version lines for {@code clibind --version}: the tool, the picocli runtime and the JVM.
 */
final class VersionProvider implements CommandLine.IVersionProvider {
    static final String DEVELOPMENT = "development";

    @Override
    public String[] getVersion() {
        return new String[] {
            "clibind " + toolVersion(),
            "picocli " + CommandLine.VERSION,
            "JVM " + System.getProperty("java.version")
        };
    }

    // set by the jar manifest, absent when running from classes
    static String toolVersion() {
        String version = Main.class.getPackage().getImplementationVersion();
        return version != null ? version : DEVELOPMENT;
    }
}
