package com.project.image.enhancement.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Describes the service. Thin controller, no logic.
 */
@RestController
public class HomeController {
    private static final Logger log = LoggerFactory.getLogger(HomeController.class);

    @GetMapping(value = "/", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, String> index() {
        log.debug("Serving home page");
        return Map.of(
                "service", "face-enhancement",
                "enhance", "POST /enhance (multipart 'file', optional 'sharpen' 0..3, 'scale' 1..4)"
        );
    }
}
