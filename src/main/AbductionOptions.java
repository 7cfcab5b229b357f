package main;

import com.beust.jcommander.IParameterValidator;
import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;

/**
 * Options for applying procedure summaries at call sites
 */
public final class AbductionOptions {

    /**
     * Flag for printing useage information
     */
    @Parameter(names = { "-h", "-help", "-useage", "--help" }, description = "Print useage information")
    private boolean help = false;

    /**
     * Level of output
     */
    @Parameter(names = { "-output", "-o" }, validateWith = AbductionOptions.NonNegativeValidator.class, description = "Level of output (higher means more console output)")
    private Integer outputLevel = 0;

    /**
     * If true, a callee cell whose facts show no write but whose edges differ between the pre and the post is an
     * internal error rather than being treated as written
     */
    @Parameter(
        names = { "-strictReadOnly" },
        description = "If set, a callee cell that has no recorded modification but whose edges differ between pre and post is reported as an internal error instead of being treated as written.")
    private boolean strictReadOnly = false;

    /**
     * Validate levels
     */
    public static class NonNegativeValidator implements IParameterValidator {

        @Override
        public void validate(String name, String value) throws ParameterException {
            int i;
            try {
                i = Integer.parseInt(value);
            }
            catch (NumberFormatException e) {
                throw new ParameterException("Parameter " + name + " should be an integer (found " + value + ")");
            }
            if (i < 0) {
                throw new ParameterException("Parameter " + name + " should be non-negative (found " + value + ")");
            }
        }
    }

    private AbductionOptions() {
        // Do not instantiate
    }

    /**
     * Options with every parameter at its default value
     *
     * @return default options
     */
    public static AbductionOptions getDefaultOptions() {
        return new AbductionOptions();
    }

    /**
     * Parse the options for the given args
     *
     * @param args arguments to parse
     * @return Options object with the parsed options available via getters
     */
    public static AbductionOptions getOptions(String[] args) {
        AbductionOptions o = new AbductionOptions();
        JCommander jc = new JCommander();
        jc.addObject(o);
        jc.parse(args);
        return o;
    }

    public Integer getOutputLevel() {
        return outputLevel;
    }

    /**
     * Is the read-only check for callee cells strict
     *
     * @return true if a cell with no recorded write must have the same edges in the pre and the post
     */
    public boolean isStrictReadOnly() {
        return strictReadOnly;
    }

    /**
     * Should we print the useage information
     *
     * @return true if we should print useage
     */
    public boolean shouldPrintUseage() {
        return help;
    }

    public static String getUseage() {
        StringBuilder sb = new StringBuilder();
        AbductionOptions o = new AbductionOptions();
        JCommander jc = new JCommander(o);
        jc.getUsageFormatter().usage(sb);
        return sb.toString();
    }
}
