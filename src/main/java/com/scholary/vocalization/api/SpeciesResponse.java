package com.scholary.vocalization.api;

import java.util.SortedSet;

public record SpeciesResponse(SortedSet<String> species) {}
