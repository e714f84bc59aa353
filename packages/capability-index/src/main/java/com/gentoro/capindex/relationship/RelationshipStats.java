package com.gentoro.capindex.relationship;

import java.util.Map;

public record RelationshipStats(
    int totalRelationships, int elementsWithRelationships, Map<String, Integer> byKind) {}
