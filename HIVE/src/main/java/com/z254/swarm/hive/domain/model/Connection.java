package com.z254.swarm.hive.domain.model;

import java.util.Objects;

/**
 * Directed, keyword-tagged routing edge between two agents.
 * Several connections may share a keyword; the triple as a whole is the identity.
 */
public record Connection(String source, String destination, String keyword) {

    public Connection {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(destination, "destination");
        Objects.requireNonNull(keyword, "keyword");
    }

    @Override
    public String toString() {
        return source + " -[" + keyword + "]-> " + destination;
    }
}
