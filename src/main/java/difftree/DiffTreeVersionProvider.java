package difftree;

import picocli.CommandLine;

public class DiffTreeVersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() throws Exception {
        String implementationVersion = Main.class.getPackage().getImplementationVersion();
        if (implementationVersion == null) {
            // not running from the packaged jar
            implementationVersion = "development";
        }
        return new String[]{"difftree " + implementationVersion};
    }
}
