package com.streamfirst.nomicon.domain;

import lombok.Getter;

/**
 * Thrown when defaults are requested for a cloud no profile is registered for.
 */
@Getter
public class UnsupportedCloudException extends NamingException {

    private final String cloud;

    public UnsupportedCloudException(String cloud) {
        super(String.format("unsupported cloud \"%s\"", cloud));
        this.cloud = cloud;
    }

    @Override
    public String errorCode() {
        return "UNSUPPORTED_CLOUD";
    }
}
