package com.example.blockalert.controller;

import com.example.blockalert.model.UserStats;
import com.example.blockalert.service.UserStatsService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/users")
@RequiredArgsConstructor
public class UserStatsController {

    private final UserStatsService userStatsService;

    @GetMapping("/{userId}/stats")
    public ResponseEntity<UserStats> stats(@PathVariable String userId) {
        return ResponseEntity.ok(userStatsService.getStats(userId));
    }
}
