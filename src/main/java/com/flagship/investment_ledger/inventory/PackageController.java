package com.flagship.investment_ledger.inventory;

import com.flagship.investment_ledger.inventory.dto.CreatePackageRequest;
import com.flagship.investment_ledger.inventory.dto.PackageResponse;
import com.flagship.investment_ledger.inventory.dto.PackageStats;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Package catalogue endpoints. Admin routes sit behind the upstream admin gateway.
 */
@RestController
@RequiredArgsConstructor
public class PackageController {

    private final PackageService packageService;

    @GetMapping("/api/packages")
    public List<PackageResponse> listPackages(
            @RequestParam(value = "kind", required = false) PackageKind kind,
            @RequestParam(value = "category", required = false) String category) {
        return packageService.listActive(kind, category).stream()
            .map(PackageResponse::from)
            .toList();
    }

    @GetMapping("/api/packages/{id}")
    public PackageResponse getPackage(@PathVariable("id") UUID id) {
        return PackageResponse.from(packageService.getPackage(id));
    }

    @PostMapping("/api/admin/packages")
    public ResponseEntity<PackageResponse> createPackage(@Valid @RequestBody CreatePackageRequest request) {
        InvestmentPackage created = packageService.createPackage(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(PackageResponse.from(created));
    }

    @GetMapping("/api/admin/packages/stats")
    public PackageStats stats() {
        return packageService.stats();
    }
}
