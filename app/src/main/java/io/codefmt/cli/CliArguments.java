package io.codefmt.cli;

import io.codefmt.config.Language;
import io.codefmt.config.LogFormat;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;

@CommandLine.Command(name = "codefmt", mixinStandardHelpOptions = true, version = "codefmt 1.0.0",
        description = "Aligns repeated call arguments and parenthesises bare comparisons in C-family sources")
public class CliArguments {

    @CommandLine.Parameters(arity = "0..*", paramLabel = "FILE", description = "Source files to format; standard input when omitted")
    private List<Path> files = new ArrayList<>();

    @CommandLine.Option(names = "--align-call-params", description = "Align the arguments of consecutive calls to the same function")
    private boolean alignCallParams;

    @CommandLine.Option(names = "--call-params-span", description = "Blank lines allowed between calls of one group (default 3)", paramLabel = "LINES")
    private Integer callParamsSpan;

    @CommandLine.Option(names = "--call-params-threshold", description = "Maximum column distance of a group member, 0 for no limit", paramLabel = "COLUMNS")
    private Integer callParamsThreshold;

    @CommandLine.Option(names = "--align-number-right", description = "Keep right-justifying numeric argument columns when tab-stop alignment is on")
    private boolean alignNumberRight;

    @CommandLine.Option(names = "--align-on-tabstop", description = "Round numeric argument columns up to the next tab stop")
    private boolean alignOnTabstop;

    @CommandLine.Option(names = "--tab-size", description = "Tab width used for columns and tab stops (default 8)", paramLabel = "COLUMNS")
    private Integer tabSize;

    @CommandLine.Option(names = "--paren-if-bool", description = "Parenthesise comparisons in if, else if and switch conditions")
    private boolean parenIfBool;

    @CommandLine.Option(names = "--paren-assign-bool", description = "Parenthesise comparisons on the right of assignments")
    private boolean parenAssignBool;

    @CommandLine.Option(names = "--paren-return-bool", description = "Parenthesise comparisons in return expressions")
    private boolean parenReturnBool;

    @CommandLine.Option(names = "--language", description = "Source language: c, cpp, cs, java, d, oc or vala", converter = OptionConverters.LanguageConverter.class)
    private Language language;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = OptionConverters.LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = "--in-place", description = "Rewrite the files instead of printing the result")
    private boolean inPlace;

    @CommandLine.Option(names = "--stage", description = "Stage rewritten files in their git repository (requires --in-place)")
    private boolean stage;

    @CommandLine.Option(names = "--git-changed", description = "Also format the source files git reports as added or modified")
    private boolean gitChanged;

    public List<Path> files() {
        return files == null ? List.of() : List.copyOf(files);
    }

    public boolean alignCallParams() {
        return alignCallParams;
    }

    public Integer callParamsSpan() {
        return callParamsSpan;
    }

    public Integer callParamsThreshold() {
        return callParamsThreshold;
    }

    public boolean alignNumberRight() {
        return alignNumberRight;
    }

    public boolean alignOnTabstop() {
        return alignOnTabstop;
    }

    public Integer tabSize() {
        return tabSize;
    }

    public boolean parenIfBool() {
        return parenIfBool;
    }

    public boolean parenAssignBool() {
        return parenAssignBool;
    }

    public boolean parenReturnBool() {
        return parenReturnBool;
    }

    public Language language() {
        return language;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public boolean inPlace() {
        return inPlace;
    }

    public boolean stage() {
        return stage;
    }

    public boolean gitChanged() {
        return gitChanged;
    }
}
