package com.cronflow.cronflow_backend.model.domain;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;

/**
 * The reusable unit of work a workflow node points at: either a script (NODEJS, PYTHON, BASH)
 * whose source lives in {@code content}, or an HTTP request described by the http* columns.
 */
@Entity
@Table(name = "events")
@Data
public class Event {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(nullable = false)
    private String name;

    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private EventType type;

    @Column(columnDefinition = "text")
    private String content;

    @Column(name = "http_method")
    private String httpMethod;

    @Column(name = "http_url", length = 1000)
    private String httpUrl;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "http_headers")
    private Map<String, String> httpHeaders;

    @Column(name = "http_body", columnDefinition = "text")
    private String httpBody;

    @Column(name = "timeout_seconds")
    private Integer timeoutSeconds = 30;

    @Column(name = "created_at")
    private Instant createdAt = Instant.now();
}
