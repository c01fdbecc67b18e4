package com.project.image.selection.controller;

import com.project.image.selection.floodfill.FillAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.GetMapping;

/**
 * Landing page listing the available fill algorithms.
 */
@Controller
public class HomeController {
    private static final Logger log = LoggerFactory.getLogger(HomeController.class);

    @Value("${app.selection.default-algorithm:SCANLINE_PARALLEL}")
    private FillAlgorithm defaultAlgorithm;

    @GetMapping("/")
    public String index(Model model) {
        log.debug("Serving landing page, default algorithm {}", defaultAlgorithm);
        model.addAttribute("algorithms", FillAlgorithm.values());
        model.addAttribute("defaultAlgorithm", defaultAlgorithm);
        return "index";
    }
}
