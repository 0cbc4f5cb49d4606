package org.yafcp.config;

import java.util.List;

public record AppConfig(PipelineConfig pipeline, ParsingOptions parsing, List<String> locators) {

    public AppConfig {
        pipeline = pipeline != null ? pipeline : PipelineConfig.defaults();
        parsing = parsing != null ? parsing : ParsingOptions.defaults();
        locators = locators != null ? List.copyOf(locators) : List.of();
    }
}
