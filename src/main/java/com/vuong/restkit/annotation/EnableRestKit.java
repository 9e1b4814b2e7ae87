package com.vuong.restkit.annotation;

import com.vuong.restkit.config.RestKitAutoConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Annotation to enable the REST kit in a Spring Boot application.
 * This imports {@link com.vuong.restkit.config.RestKitAutoConfiguration}, which registers the
 * request pipeline, the paginator and the controller serving every
 * {@link com.vuong.restkit.core.resource.Resource} bean.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Import({RestKitAutoConfiguration.class})
public @interface EnableRestKit {
}
