package com.scholary.relay.gateway;

/** Authenticated caller, identified by the subject of its credential. */
public record Principal(String id) {}
