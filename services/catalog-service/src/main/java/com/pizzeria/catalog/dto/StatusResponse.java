package com.pizzeria.catalog.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * StatusResponse - confirmation body of delete operations.
 *
 * Example: {@code {"status": "completed", "detail": "Ingredient Basil with id 2 deleted"}}
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StatusResponse {

    private String status;

    private String detail;

    public static StatusResponse completed(String detail) {
        return new StatusResponse("completed", detail);
    }
}
