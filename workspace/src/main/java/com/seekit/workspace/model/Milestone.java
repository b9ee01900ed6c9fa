package com.seekit.workspace.model;

import jakarta.persistence.*;
import java.time.LocalDate;

/**
 * One step of a project's delivery plan.
 *
 * Created in bulk with the project, then moved through its review states
 * by deliverable submissions and client decisions (see MilestoneStatus).
 *
 * DB table: milestones  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "milestones")
public class Milestone {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "project_id", nullable = false)
    private Project project;

    @Column(name = "milestone_name", nullable = false, columnDefinition = "TEXT")
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private MilestoneStatus status = MilestoneStatus.PENDING;

    // 1-based, unique within the project.
    @Column(name = "order_number", nullable = false)
    private int orderNumber;

    @Column(name = "due_date")
    private LocalDate dueDate;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Milestone() {}   // required by JPA

    public Milestone(Project project, String name, String description, int orderNumber) {
        this.project     = project;
        this.name        = name;
        this.description = description;
        this.orderNumber = orderNumber;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public Long            getId()          { return id; }
    public Project         getProject()     { return project; }
    public String          getName()        { return name; }
    public String          getDescription() { return description; }
    public MilestoneStatus getStatus()      { return status; }
    public int             getOrderNumber() { return orderNumber; }
    public LocalDate       getDueDate()     { return dueDate; }

    public void setStatus(MilestoneStatus status) { this.status = status; }
    public void setDueDate(LocalDate dueDate)     { this.dueDate = dueDate; }

    public boolean isApproved() {
        return status == MilestoneStatus.APPROVED;
    }
}
