package com.pizzeria.catalog.dto;

import com.pizzeria.catalog.entity.PermissionLevel;
import com.pizzeria.catalog.entity.User;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * UserResponse - public view of a {@link User}. Carries no password material.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserResponse {

    private Long id;

    private String username;

    private String email;

    private PermissionLevel permissionLevel;

    public static UserResponse from(User user) {
        return UserResponse.builder()
                .id(user.getId())
                .username(user.getUsername())
                .email(user.getEmail())
                .permissionLevel(user.getPermissionLevel())
                .build();
    }
}
