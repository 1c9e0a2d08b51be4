package com.automaker.core.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A unit of autonomous work, persisted as {@code feature.json} in the project's feature store.
 * <p>
 * Features are created by other tools (the board UI, spec importers), so properties this
 * class does not model are kept in {@link #getExtra()} and written back unchanged.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Feature {

    private String id;
    private String title;
    private String description;
    private String status;
    private String branchName;
    private String model;
    private PlanningMode planningMode;
    private Boolean requirePlanApproval;
    private PlanSpec planSpec;
    private Boolean skipTests;
    private String spec;
    private Integer priority;
    private List<String> dependencies = new ArrayList<>();
    private List<String> imagePaths = new ArrayList<>();
    private Instant updatedAt;
    private Instant justFinishedAt;

    private final Map<String, Object> extra = new LinkedHashMap<>();

    public Feature() {}

    public Feature(String id, String description, String status) {
        this.id = id;
        this.description = description;
        this.status = status;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }
    public String getBranchName() { return branchName; }
    public void setBranchName(String branchName) { this.branchName = branchName; }
    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }
    public PlanningMode getPlanningMode() { return planningMode; }
    public void setPlanningMode(PlanningMode planningMode) { this.planningMode = planningMode; }
    public Boolean getRequirePlanApproval() { return requirePlanApproval; }
    public void setRequirePlanApproval(Boolean requirePlanApproval) { this.requirePlanApproval = requirePlanApproval; }
    public PlanSpec getPlanSpec() { return planSpec; }
    public void setPlanSpec(PlanSpec planSpec) { this.planSpec = planSpec; }
    public Boolean getSkipTests() { return skipTests; }
    public void setSkipTests(Boolean skipTests) { this.skipTests = skipTests; }
    public String getSpec() { return spec; }
    public void setSpec(String spec) { this.spec = spec; }
    public Integer getPriority() { return priority; }
    public void setPriority(Integer priority) { this.priority = priority; }
    public List<String> getDependencies() { return dependencies; }
    public void setDependencies(List<String> dependencies) { this.dependencies = dependencies != null ? dependencies : new ArrayList<>(); }
    public List<String> getImagePaths() { return imagePaths; }
    public void setImagePaths(List<String> imagePaths) { this.imagePaths = imagePaths != null ? imagePaths : new ArrayList<>(); }
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
    public Instant getJustFinishedAt() { return justFinishedAt; }
    public void setJustFinishedAt(Instant justFinishedAt) { this.justFinishedAt = justFinishedAt; }

    @JsonAnyGetter
    public Map<String, Object> getExtra() { return extra; }

    @JsonAnySetter
    public void setExtra(String key, Object value) { extra.put(key, value); }

    public PlanningMode effectivePlanningMode() {
        return planningMode != null ? planningMode : PlanningMode.SKIP;
    }

    public boolean requiresPlanApproval() {
        return Boolean.TRUE.equals(requirePlanApproval);
    }

    public boolean skipsTests() {
        return Boolean.TRUE.equals(skipTests);
    }

    /**
     * Title for display and commit messages. Falls back to the first line of the description,
     * capped at 60 characters.
     */
    public String displayTitle() {
        if (title != null && !title.isBlank()) {
            return title;
        }
        return extractTitleFromDescription(description);
    }

    public static String extractTitleFromDescription(String description) {
        if (description == null || description.isBlank()) {
            return "Untitled Feature";
        }
        String firstLine = description.split("\n", 2)[0].trim();
        if (firstLine.length() <= 60) {
            return firstLine;
        }
        return firstLine.substring(0, 57) + "...";
    }
}
