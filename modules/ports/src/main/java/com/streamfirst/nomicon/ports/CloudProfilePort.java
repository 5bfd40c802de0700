package com.streamfirst.nomicon.ports;

import com.streamfirst.nomicon.domain.CloudDefaults;

/**
 * Port for a source of per-cloud default naming data.
 * Each implementation serves one cloud; the registry maps normalized cloud identifiers to
 * implementations, so adding a cloud never touches the naming engine.
 */
public interface CloudProfilePort {

    /**
     * Returns the normalized identifier this profile serves.
     *
     * @return lowercase cloud identifier (e.g., "aws", "azure")
     */
    String cloud();

    /**
     * Returns this cloud's default tables.
     * Every call returns an independent copy; mutating it never affects the profile or any
     * copy handed to another caller. Safe to call concurrently.
     *
     * @return a fresh copy of the default tables
     * @throws com.streamfirst.nomicon.domain.ProfileDecodeException if the profile derives its
     *     tables from a dataset that cannot be decoded
     */
    CloudDefaults defaults();
}
