package org.yafcp.plugin;

public class ParseException extends PipelineException {

    public enum Kind {
        MALFORMED,           // input the parser cannot turn into records
        UNSUPPORTED_OPTIONS  // options the parser does not understand
    }

    private final Kind kind;

    public ParseException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static ParseException malformed(String message, Throwable cause) {
        return new ParseException(Kind.MALFORMED, message, cause);
    }

    public static ParseException unsupportedOptions(String message) {
        return new ParseException(Kind.UNSUPPORTED_OPTIONS, message, null);
    }

    public Kind kind() {
        return kind;
    }

    @Override
    public String category() {
        return kind == Kind.MALFORMED ? "ParseError::Malformed" : "ParseError::UnsupportedOptions";
    }
}
