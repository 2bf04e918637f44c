package com.craftsman.coordinator.api;

import com.craftsman.coordinator.api.dto.RoleResponse;
import com.craftsman.coordinator.role.RoleRegistry;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

/**
 * GET /roles      : every configured role
 * GET /roles/{id}  : one role, 404 if unknown
 */
@RestController
@RequestMapping("/roles")
public class RoleController {

    private final RoleRegistry roles;

    public RoleController(RoleRegistry roles) {
        this.roles = roles;
    }

    @GetMapping
    public List<RoleResponse> list() {
        return roles.all().stream().map(RoleResponse::from).toList();
    }

    @GetMapping("/{id}")
    public RoleResponse get(@PathVariable String id) {
        if (!roles.contains(id)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Role not found: " + id);
        }
        return RoleResponse.from(roles.lookup(id));
    }
}
