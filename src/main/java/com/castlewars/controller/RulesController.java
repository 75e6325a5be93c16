package com.castlewars.controller;
import com.castlewars.config.GameProperties;
import com.castlewars.snapshot.RulesView;
import org.springframework.web.bind.annotation.*;

@RestController
public class RulesController {
    private final GameProperties properties;
    public RulesController(GameProperties properties) { this.properties = properties; }

    @GetMapping("/api/rules")
    public RulesView getRules() {
        return RulesView.of(properties);
    }
}
