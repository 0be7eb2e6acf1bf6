package com.foodvision.backend.scan.controller;

import com.foodvision.backend.scan.dto.CorrectRequest;
import com.foodvision.backend.scan.dto.CorrectResponse;
import com.foodvision.backend.scan.dto.HistoryResponse;
import com.foodvision.backend.scan.service.MealCorrectionService;
import com.foodvision.backend.scan.service.MealDeleteService;
import com.foodvision.backend.scan.service.MealHistoryService;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@Tag(name = "MealHistory", description = "Scan history + label correction")
@RequiredArgsConstructor
@RestController
@RequestMapping("/api")
public class MealHistoryController {

    private final MealHistoryService historyService;
    private final MealCorrectionService correctionService;
    private final MealDeleteService deleteService;

    @PostMapping("/correct")
    public CorrectResponse correct(@Valid @RequestBody CorrectRequest body) {
        return correctionService.correct(body.mealId(), body.newLabel());
    }

    @GetMapping("/history")
    public HistoryResponse history(@RequestParam(value = "limit", defaultValue = "50") int limit) {
        return new HistoryResponse(historyService.read(limit));
    }

    @DeleteMapping("/history/{mealId}")
    public Map<String, Object> delete(@PathVariable("mealId") Long mealId) {
        deleteService.delete(mealId);
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("status", "deleted");
        out.put("meal_id", mealId);
        return out;
    }

    @DeleteMapping("/history")
    public Map<String, Object> clear() {
        deleteService.clear();
        return Map.of("status", "cleared");
    }
}
