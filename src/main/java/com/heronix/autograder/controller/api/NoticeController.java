package com.heronix.autograder.controller.api;

import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.heronix.autograder.model.dto.UserNotice;
import com.heronix.autograder.service.NoticeService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;

/**
 * Recent user notices, newest first.
 */
@RestController
@RequestMapping("/api/v1/autograder/notices")
@RequiredArgsConstructor
@Tag(name = "Notices", description = "User-visible outcome notices")
public class NoticeController {

    private final NoticeService noticeService;

    @GetMapping
    @Operation(summary = "Recent notices")
    public ResponseEntity<List<UserNotice>> recent(@RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(noticeService.recent(Math.max(0, limit)));
    }
}
