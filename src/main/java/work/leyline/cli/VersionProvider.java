package work.leyline.cli;

import picocli.CommandLine;

final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        String implementationVersion = Main.class.getPackage().getImplementationVersion();
        return new String[] {
            "leyline (java) " + (implementationVersion != null ? implementationVersion : "development"),
            "JVM: " + System.getProperty("java.vm.name") + " " + Runtime.version()
        };
    }
}
