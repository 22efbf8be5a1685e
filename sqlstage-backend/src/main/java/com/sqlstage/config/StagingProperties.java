package com.sqlstage.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Policy for moving large results out of the HTTP response and into the result cache.
 */
@Data
@ConfigurationProperties(prefix = "sqlstage.staging")
public class StagingProperties {

    /** Results with more rows than this are staged in the cache and served page by page. */
    private int largeResultThreshold = 1000;
}
