package com.satmobile.backend.global.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * @param batchLimit operations per committed batch; kept below the store ceiling of 500
 */
@ConfigurationProperties(prefix = "satmobile.sync")
public record SyncProperties(@DefaultValue("450") int batchLimit) {
}
