package com.certwatch.poller.model;

import lombok.Data;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Body of {@code POST /api/start-polling}.
 *
 * Older clients send a single {@code searchName}; newer ones send {@code targetNames}.
 * Both collapse into one ordered list via {@link #resolvedTargetNames()}.
 */
@Data
public class StartPollingRequest {

    private LocalDate startDate;
    private LocalDate endDate;
    private String gender;
    private String searchName;
    private List<String> targetNames;
    private Integer intervalMinutes;

    public List<String> resolvedTargetNames() {
        List<String> names = new ArrayList<>();
        if (targetNames != null) {
            targetNames.stream()
                    .filter(n -> n != null && !n.isBlank())
                    .map(String::trim)
                    .forEach(names::add);
        }
        if (searchName != null && !searchName.isBlank() && !names.contains(searchName.trim())) {
            names.add(0, searchName.trim());
        }
        return names;
    }
}
