package com.architecture.memory.codegraph.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Output of diff extraction for one pull request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChangeSet {

    @Builder.Default
    private List<String> changedFiles = new ArrayList<>();

    // Qualified names of added or modified entities
    @Builder.Default
    private List<String> changedEntityNames = new ArrayList<>();

    // Qualified names of entities removed by the change; still present in the last built graph
    @Builder.Default
    private List<String> deletedEntityNames = new ArrayList<>();
}
