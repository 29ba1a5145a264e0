package com.example.shiftplanner.employee;

import jakarta.persistence.*;

import java.time.LocalDate;

@Entity
@Table(name = "absences", indexes = {
        @Index(name = "idx_absence_employee_dates", columnList = "employee_id, date_start, date_end")
})
public class Absence {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "employee_id", nullable = false, length = 64)
    private String employeeId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AbsenceType type;

    // inclusive range
    @Column(name = "date_start", nullable = false)
    private LocalDate dateStart;

    @Column(name = "date_end", nullable = false)
    private LocalDate dateEnd;

    @Column(nullable = false)
    private Boolean approved = false;

    @Column(length = 200)
    private String reason;

    protected Absence() {
    }

    public Absence(String employeeId, AbsenceType type, LocalDate dateStart, LocalDate dateEnd, boolean approved) {
        this.employeeId = employeeId;
        this.type = type;
        this.dateStart = dateStart;
        this.dateEnd = dateEnd;
        this.approved = approved;
    }

    public boolean covers(LocalDate date) {
        return !date.isBefore(dateStart) && !date.isAfter(dateEnd);
    }

    public Long getId() { return id; }
    public String getEmployeeId() { return employeeId; }
    public AbsenceType getType() { return type; }
    public LocalDate getDateStart() { return dateStart; }
    public LocalDate getDateEnd() { return dateEnd; }
    public Boolean getApproved() { return approved; }
    public void setApproved(Boolean approved) { this.approved = approved; }
    public String getReason() { return reason; }
    public void setReason(String reason) { this.reason = reason; }
}
