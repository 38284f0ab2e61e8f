package com.exohunt.error;

/**
 * Raised when source bytes cannot be read as a light curve or carry no usable flux column.
 */
public class DataFormatException extends AnalysisException {

    public DataFormatException(String message) {
        super(ErrorKind.DATA_FORMAT, message);
    }

    public DataFormatException(String message, Throwable cause) {
        super(ErrorKind.DATA_FORMAT, message, cause);
    }
}
