package com.flagship.personal_ledger.category;

import com.flagship.personal_ledger.category.dto.CategoryRequest;
import com.flagship.personal_ledger.category.dto.CategoryResponse;
import com.flagship.personal_ledger.security.OwnerContext;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/categories")
@RequiredArgsConstructor
public class CategoryController {

    private final CategoryService categoryService;

    @PostMapping
    public ResponseEntity<CategoryResponse> createCategory(@Valid @RequestBody CategoryRequest request) {
        Category category = categoryService.createCategory(OwnerContext.requireOwnerId(),
            request.getName(), request.getFlowType());
        return ResponseEntity.status(HttpStatus.CREATED).body(CategoryResponse.from(category));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<CategoryResponse> renameCategory(@PathVariable("id") UUID id,
                                                           @Valid @RequestBody CategoryRequest request) {
        Category category = categoryService.renameCategory(OwnerContext.requireOwnerId(), id, request.getName());
        return ResponseEntity.ok(CategoryResponse.from(category));
    }
}
