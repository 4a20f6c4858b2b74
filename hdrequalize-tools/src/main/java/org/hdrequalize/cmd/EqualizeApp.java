package org.hdrequalize.cmd;

import java.util.Arrays;
import java.util.List;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main class for the histogram equalization commands.
 */
public class EqualizeApp {

    private static final Logger LOG = LoggerFactory.getLogger(EqualizeApp.class);

    public static void main(String[] argv) {
        int status = run(argv);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * @return the process exit status
     */
    static int run(String... argv) {
        CommonArgs commonArgs = new CommonArgs();
        List<AbstractCmd> cmds = Arrays.asList(
                new EqualizeImageCmd("equalize", commonArgs)
        );
        JCommander.Builder cmdlineBuilder = JCommander.newBuilder().programName(EqualizeApp.class.getSimpleName());
        cmds.forEach(cmd -> cmdlineBuilder.addCommand(cmd.getCommandName(), cmd.getArgs()));
        JCommander cmdline = cmdlineBuilder.build();

        try {
            cmdline.parse(argv);
        } catch (ParameterException e) {
            System.err.println(e.getMessage());
            cmdline.usage();
            return 1;
        }
        if (commonArgs.displayHelpMessage) {
            cmdline.usage();
            return 0;
        }
        String parsedCommand = cmdline.getParsedCommand();
        AbstractCmd cmd = cmds.stream()
                .filter(c -> c.matches(parsedCommand))
                .findFirst()
                .orElse(null);
        if (cmd == null) {
            System.err.println("Missing or invalid command: " + parsedCommand);
            cmdline.usage();
            return 1;
        }
        List<String> validationErrors = cmd.getArgs().validate();
        if (!validationErrors.isEmpty()) {
            validationErrors.forEach(System.err::println);
            cmdline.usage();
            return 1;
        }
        try {
            cmd.execute();
        } catch (IllegalArgumentException e) {
            LOG.error("Invalid {} arguments", cmd.getCommandName(), e);
            System.err.println(e.getMessage());
            return 1;
        }
        return 0;
    }
}
