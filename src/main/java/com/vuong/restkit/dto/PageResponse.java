package com.vuong.restkit.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Envelope returned by list endpoints.
 * The links are always written, as null when there is no such page.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonPropertyOrder({"count", "next", "previous", "result"})
public class PageResponse {
    /** Total number of matching items across all pages. */
    private long count;
    /** Absolute URL of the following page. */
    private String next;
    /** Absolute URL of the preceding page. */
    private String previous;
    /** Serialized items of the current page. */
    private List<?> result;
}
