package com.licitia.etl.domain.entity;

import com.licitia.etl.domain.enums.Frequency;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(
        name = "tasks",
        schema = "scheduler",
        uniqueConstraints = @UniqueConstraint(columnNames = {"conjunto", "subconjunto"})
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Task {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "task_id")
    private Long id;

    @Column(name = "conjunto", nullable = false)
    private String dataset;

    @Column(name = "subconjunto", nullable = false)
    private String subset;

    @Convert(converter = FrequencyConverter.class)
    @Column(name = "schedule_expr")
    private Frequency frequency;

    @Builder.Default
    @Column(nullable = false)
    private boolean enabled = true;

    @Builder.Default
    @Column(name = "created_at", nullable = false)
    private Instant createdAt = Instant.now();

    @Builder.Default
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void preUpdate() {
        this.updatedAt = Instant.now();
    }

    public String key() {
        return dataset + "/" + subset;
    }
}
