package com.storefront.api;

import com.storefront.api.dto.ApiResponse;
import com.storefront.api.dto.PageResponse;
import com.storefront.api.dto.StockAdjustmentRequest;
import com.storefront.domain.model.LowStockVariant;
import com.storefront.domain.model.MovementFilter;
import com.storefront.domain.model.StockAdjustment;
import com.storefront.domain.model.StockSummary;
import com.storefront.domain.service.StockLedgerService;
import com.storefront.infrastructure.persistence.entity.StockMovementEntity;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Operator access to the stock ledger.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/stock")
@RequiredArgsConstructor
public class StockController {

    private static final int MAX_PAGE_SIZE = 100;

    private final StockLedgerService stockLedger;

    @PostMapping("/adjustments")
    public ResponseEntity<ApiResponse<StockAdjustment>> adjust(@Valid @RequestBody StockAdjustmentRequest request) {
        log.info("Manual stock {} of {} for variant {}", request.type(), request.quantity(), request.variantId());

        StockAdjustment adjustment = stockLedger.adjust(request.variantId(), request.quantity(), request.type(),
                request.reason(), request.actorId(), null);

        return ResponseEntity.ok(ApiResponse.ok(adjustment, "Stock adjusted"));
    }

    @GetMapping("/summary")
    public ResponseEntity<ApiResponse<StockSummary>> summary() {
        return ResponseEntity.ok(ApiResponse.ok(stockLedger.summary()));
    }

    @GetMapping("/low-stock")
    public ResponseEntity<ApiResponse<PageResponse<LowStockVariant>>> lowStock(
            @RequestParam(required = false) Integer threshold,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size) {

        return ResponseEntity.ok(ApiResponse.ok(
                PageResponse.of(stockLedger.lowStock(threshold, page, Math.min(size, MAX_PAGE_SIZE)))));
    }

    @GetMapping("/movements")
    public ResponseEntity<ApiResponse<PageResponse<StockMovementEntity>>> movements(
            @RequestParam(required = false) UUID variantId,
            @RequestParam(required = false) StockMovementEntity.MovementType type,
            @RequestParam(required = false) Integer days,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "50") int size) {

        return ResponseEntity.ok(ApiResponse.ok(PageResponse.of(
                stockLedger.movements(new MovementFilter(variantId, type, days), page, Math.min(size, MAX_PAGE_SIZE)))));
    }
}
