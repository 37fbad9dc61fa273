package com.flagship.custodial_exchange.registry;

import com.flagship.custodial_exchange.registry.dto.AssetOwnerResponse;
import com.flagship.custodial_exchange.registry.dto.MintAssetRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST surface of the bundled asset registry.
 */
@RestController
@RequestMapping("/api/assets")
@RequiredArgsConstructor
public class AssetController {

    private final AssetRegistryService assetRegistryService;

    @PostMapping
    public ResponseEntity<AssetOwnerResponse> mint(@Valid @RequestBody MintAssetRequest request) {
        assetRegistryService.mint(request.getAssetId(), request.getOwner());
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(new AssetOwnerResponse(request.getAssetId(), request.getOwner()));
    }

    @GetMapping("/{assetId}/owner")
    public ResponseEntity<AssetOwnerResponse> owner(@PathVariable("assetId") String assetId) {
        return ResponseEntity.ok(new AssetOwnerResponse(assetId, assetRegistryService.ownerOf(assetId)));
    }
}
