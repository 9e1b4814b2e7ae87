package com.vuong.restkit.core.pagination;

import com.vuong.restkit.config.RestKitProperties;
import com.vuong.restkit.dto.PageResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Date;
import java.util.List;

/**
 * Wraps one page of serialized items in the list envelope and builds the links
 * to the neighbouring pages.
 * <p>
 * The items are expected to be the requested page already; the paginator never slices.
 */
@Component
public class Paginator {

    private static final Logger logger = LoggerFactory.getLogger(Paginator.class);

    private final RestKitProperties.Pagination settings;

    public Paginator(RestKitProperties properties) {
        this.settings = properties.getPagination();
    }

    /**
     * @return the query parameters that select the page rather than filter the items
     */
    public List<String> getPageParameters() {
        return List.of(settings.getPageParameter(), settings.getPageSizeParameter());
    }

    /**
     * Reads the requested page from query parameters.
     * @param queryParams the request's query parameters
     * @return the page selection, defaulting to page 1 of the configured size
     */
    public PageQuery resolvePage(MultiValueMap<String, ?> queryParams) {
        return PageQuery.from(queryParams, settings.getPageParameter(), settings.getPageSizeParameter(),
                settings.getDefaultPageSize());
    }

    /**
     * Builds the list envelope.
     * @param items the serialized items of the current page
     * @param count total number of matching items
     * @param page the page the items belong to
     * @param resourceUri absolute URI of the resource, without query
     * @param queryParams the request's query parameters, reused for the links
     * @return the envelope with count, links and items
     */
    public PageResponse paginate(List<?> items, long count, PageQuery page, URI resourceUri,
                                 MultiValueMap<String, ?> queryParams) {
        int current = page.getPage();
        int pageSize = page.getPageSize();

        String previous = null;
        if (current > 1) {
            long target = (long) pageSize * (current - 1) > count ? count / pageSize + 1 : current - 1;
            previous = pageLink(resourceUri, queryParams, target);
        }

        String next = null;
        if ((long) current * pageSize < count) {
            next = pageLink(resourceUri, queryParams, current + 1L);
        }

        logger.debug("Paginated {} of {} items for {} (previous={}, next={})",
                items.size(), count, page, previous, next);
        return new PageResponse(count, next, previous, items);
    }

    private String pageLink(URI resourceUri, MultiValueMap<String, ?> queryParams, long targetPage) {
        MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
        queryParams.forEach((key, values) -> values.forEach(value -> params.add(encode(key), encode(format(value)))));
        params.set(encode(settings.getPageParameter()), String.valueOf(targetPage));

        return UriComponentsBuilder.fromUri(resourceUri)
                .replaceQuery(null)
                .queryParams(params)
                .build(true)
                .toUriString();
    }

    // '+' is legal in a query but decodes to a space on most servers
    private static String encode(String queryPart) {
        return UriUtils.encodeQueryParam(queryPart, StandardCharsets.UTF_8).replace("+", "%2B");
    }

    static String format(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Boolean bool) {
            return bool ? "true" : "false";
        }
        if (value instanceof ZonedDateTime zoned) {
            return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(zoned);
        }
        if (value instanceof OffsetDateTime || value instanceof LocalDateTime || value instanceof LocalDate
                || value instanceof LocalTime || value instanceof Instant) {
            return value.toString();
        }
        if (value instanceof java.sql.Date sqlDate) {
            return sqlDate.toLocalDate().toString();
        }
        if (value instanceof Date date) {
            return date.toInstant().toString();
        }
        return value.toString();
    }
}
