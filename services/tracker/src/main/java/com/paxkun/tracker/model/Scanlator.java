package com.paxkun.tracker.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A scanlation site. {@code pluginKey} is the only name stored; the display name comes from
 * the plugin registered under that key.
 */
@Entity
@Table(
        name = "scanlators",
        uniqueConstraints = @UniqueConstraint(name = "uk_scanlators_plugin_key", columnNames = "plugin_key")
)
@Getter
@Setter
@NoArgsConstructor
public class Scanlator {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "plugin_key", nullable = false, length = 100)
    private String pluginKey;

    @Column(name = "base_url", length = 500)
    private String baseUrl;

    @Column(nullable = false)
    private boolean active = true;

    public Scanlator(String pluginKey, String baseUrl) {
        this.pluginKey = pluginKey;
        this.baseUrl = baseUrl;
    }
}
