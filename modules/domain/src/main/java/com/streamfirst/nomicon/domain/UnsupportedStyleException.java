package com.streamfirst.nomicon.domain;

/**
 * Thrown when a name would have to be rendered in a style that is unknown or not allowed for the
 * resource type.
 */
public class UnsupportedStyleException extends NamingException {

    public UnsupportedStyleException(String message) {
        super(message);
    }

    @Override
    public String errorCode() {
        return "UNSUPPORTED_STYLE";
    }
}
