package org.themecheck.checks;

/**
 * Signals that the configuration entry of a check does not match the check's schema.
 */
public class CheckConfigurationException extends Exception {

    private final String checkCode;

    public CheckConfigurationException(String checkCode, String message, Throwable cause) {
        super(message, cause);
        this.checkCode = checkCode;
    }

    public CheckConfigurationException(String checkCode, String message) {
        this(checkCode, message, null);
    }

    public String getCheckCode() {
        return checkCode;
    }
}
