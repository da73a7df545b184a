package com.example.idm.domain.entity;

/**
 * A request state as written to the cache, with the identifier it was written under.
 */
public record PersistedState(String state, RequestState requestState) {}
