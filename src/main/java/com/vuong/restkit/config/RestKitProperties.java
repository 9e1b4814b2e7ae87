package com.vuong.restkit.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the REST kit.
 */
@Component
@ConfigurationProperties(prefix = "restkit")
@Getter
@Setter
public class RestKitProperties {

    /**
     * Path prefix under which resources are served.
     */
    private String apiPrefix = "/api";

    private Pagination pagination = new Pagination();

    @Getter
    @Setter
    public static class Pagination {
        /**
         * Page size used when the request does not carry one.
         */
        private int defaultPageSize = 10;

        /**
         * Query parameter holding the 1-based page number.
         */
        private String pageParameter = "page";

        /**
         * Query parameter holding the page size.
         */
        private String pageSizeParameter = "page_size";
    }
}
