package org.mu0.assembler.api;

/**
 * Thrown when assembly fails. Assembly is all-or-nothing: when this is thrown no program exists.
 * <p>
 * It is part of the public API and carries an {@link AssemblerErrorCode} plus, for errors tied
 * to a line, the {@link SourceInfo} of the offending line.
 */
public class AssemblyException extends Exception {

    private final AssemblerErrorCode errorCode;
    private final SourceInfo sourceInfo;

    /**
     * Constructs an exception for an error on a specific source line.
     * @param errorCode The error class.
     * @param detail What exactly is wrong.
     * @param sourceInfo The offending line.
     */
    public AssemblyException(AssemblerErrorCode errorCode, String detail, SourceInfo sourceInfo) {
        super(String.format("%s: %s at %s", errorCode.description(), detail, sourceInfo));
        this.errorCode = errorCode;
        this.sourceInfo = sourceInfo;
    }

    /**
     * Constructs an exception that is not tied to a line.
     * @param errorCode The error class.
     * @param detail What exactly is wrong.
     * @param cause The cause.
     */
    public AssemblyException(AssemblerErrorCode errorCode, String detail, Throwable cause) {
        super(String.format("%s: %s", errorCode.description(), detail), cause);
        this.errorCode = errorCode;
        this.sourceInfo = null;
    }

    /**
     * @return The error class.
     */
    public AssemblerErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * @return The offending line, or {@code null} if the error is not tied to one.
     */
    public SourceInfo getSourceInfo() {
        return sourceInfo;
    }
}
