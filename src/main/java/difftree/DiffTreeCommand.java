package difftree;

import picocli.CommandLine;

import java.util.concurrent.Callable;

@CommandLine.Command(name = "difftree",
        mixinStandardHelpOptions = true,
        subcommands = {Show.class, Resolve.class},
        versionProvider = DiffTreeVersionProvider.class,
        description = "Browse the changes between two backup archives")
public class DiffTreeCommand implements Callable<Integer> {

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        spec.commandLine().usage(System.err);
        return 0;
    }
}
