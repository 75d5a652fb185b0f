package com.koni.greenhouse.infrastructure.web.dto;

import lombok.Getter;

import java.util.List;

/**
 * Envelope for list endpoints: {@code {"success": true, "count": n, "data": [...]}}.
 */
@Getter
public class ListResponse<T> {

    private final boolean success = true;
    private final int count;
    private final List<T> data;

    public ListResponse(List<T> data) {
        this.count = data.size();
        this.data = data;
    }
}
