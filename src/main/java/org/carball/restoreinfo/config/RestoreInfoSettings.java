package org.carball.restoreinfo.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * Optional YAML settings file. Unset values leave the defaults in place.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class RestoreInfoSettings {

    @JsonProperty("output_file")
    private String outputFile;

    @JsonProperty("output_format")
    private String outputFormat;

    @JsonProperty("verbose")
    private Boolean verbose;
}
