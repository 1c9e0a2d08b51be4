package com.automaker.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Generated plan embedded in a {@link Feature}, with approval and task-progress metadata.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PlanSpec {

    private PlanSpecStatus status = PlanSpecStatus.PENDING;
    private String content;
    private int version = 1;
    private Instant generatedAt;
    private Instant approvedAt;
    private Boolean reviewedByUser;
    private List<ParsedTask> tasks = new ArrayList<>();
    private Integer tasksCompleted;
    private Integer tasksTotal;
    private String currentTaskId;

    public static PlanSpec initial() {
        return new PlanSpec();
    }

    public PlanSpecStatus getStatus() { return status; }
    public void setStatus(PlanSpecStatus status) { this.status = status; }
    public String getContent() { return content; }
    public void setContent(String content) { this.content = content; }
    public int getVersion() { return version; }
    public void setVersion(int version) { this.version = version; }
    public Instant getGeneratedAt() { return generatedAt; }
    public void setGeneratedAt(Instant generatedAt) { this.generatedAt = generatedAt; }
    public Instant getApprovedAt() { return approvedAt; }
    public void setApprovedAt(Instant approvedAt) { this.approvedAt = approvedAt; }
    public Boolean getReviewedByUser() { return reviewedByUser; }
    public void setReviewedByUser(Boolean reviewedByUser) { this.reviewedByUser = reviewedByUser; }
    public List<ParsedTask> getTasks() { return tasks; }
    public void setTasks(List<ParsedTask> tasks) { this.tasks = tasks != null ? tasks : new ArrayList<>(); }
    public Integer getTasksCompleted() { return tasksCompleted; }
    public void setTasksCompleted(Integer tasksCompleted) { this.tasksCompleted = tasksCompleted; }
    public Integer getTasksTotal() { return tasksTotal; }
    public void setTasksTotal(Integer tasksTotal) { this.tasksTotal = tasksTotal; }
    public String getCurrentTaskId() { return currentTaskId; }
    public void setCurrentTaskId(String currentTaskId) { this.currentTaskId = currentTaskId; }
}
