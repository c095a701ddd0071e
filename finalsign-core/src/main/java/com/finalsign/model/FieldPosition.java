package com.finalsign.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * Normalized placement of a field on a template page.
 */
@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@EqualsAndHashCode
@ToString
public class FieldPosition {

    @Column(name = "pos_x", nullable = false)
    private Double x;

    @Column(name = "pos_y", nullable = false)
    private Double y;

    @Column(name = "pos_width", nullable = false)
    private Double width;

    @Column(name = "pos_height", nullable = false)
    private Double height;

    @Column(name = "pos_page", nullable = false)
    private Integer page;
}
