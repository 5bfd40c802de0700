package com.streamfirst.nomicon.domain;

/**
 * Thrown when a derived cloud profile cannot decode its embedded dataset. The profile remembers
 * the failure and reports it again on every later request.
 */
public class ProfileDecodeException extends NamingException {

    public ProfileDecodeException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String errorCode() {
        return "PROFILE_DECODE_ERROR";
    }
}
