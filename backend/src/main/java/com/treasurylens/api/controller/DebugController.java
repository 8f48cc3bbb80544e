package com.treasurylens.api.controller;

import com.treasurylens.resilience.DebugRecord;
import com.treasurylens.resilience.RecentFailuresDebugSink;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * GET /api/v1/debug/failures: recent gate failures and short-circuits, newest last.
 */
@RestController
@RequestMapping("/api/v1/debug")
@RequiredArgsConstructor
public class DebugController {

    private final RecentFailuresDebugSink debugSink;

    @GetMapping("/failures")
    public List<DebugRecord> failures() {
        return debugSink.recent();
    }
}
