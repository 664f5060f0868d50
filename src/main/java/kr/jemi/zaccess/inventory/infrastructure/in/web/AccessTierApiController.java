package kr.jemi.zaccess.inventory.infrastructure.in.web;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import kr.jemi.zaccess.inventory.application.port.in.CreateAccessTierCommand;
import kr.jemi.zaccess.inventory.application.port.in.CreateAccessTierUseCase;
import kr.jemi.zaccess.inventory.application.port.in.GetStockStatusUseCase;
import kr.jemi.zaccess.inventory.domain.AccessTier;
import kr.jemi.zaccess.inventory.infrastructure.in.web.dto.AccessTierResponse;
import kr.jemi.zaccess.inventory.infrastructure.in.web.dto.CreateAccessTierRequest;
import kr.jemi.zaccess.inventory.infrastructure.in.web.dto.StockStatusResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "AccessTier", description = "티켓 등급과 재고 현황")
@RestController
public class AccessTierApiController {

    private final CreateAccessTierUseCase createAccessTierUseCase;
    private final GetStockStatusUseCase getStockStatusUseCase;

    public AccessTierApiController(CreateAccessTierUseCase createAccessTierUseCase,
                                   GetStockStatusUseCase getStockStatusUseCase) {
        this.createAccessTierUseCase = createAccessTierUseCase;
        this.getStockStatusUseCase = getStockStatusUseCase;
    }

    @Operation(summary = "티켓 등급 생성", description = "공연 준비 단계에서 판매할 등급과 총 수량을 등록합니다.")
    @PostMapping("/api/access-tiers")
    public ResponseEntity<AccessTierResponse> create(@Valid @RequestBody CreateAccessTierRequest request) {
        AccessTier tier = createAccessTierUseCase.create(new CreateAccessTierCommand(
                request.eventId(), request.name(), request.price(), request.totalQuantity()));
        return ResponseEntity.status(HttpStatus.CREATED).body(AccessTierResponse.from(tier));
    }

    @Operation(summary = "재고 현황 조회", description = "판매·선점·잔여 수량과 활성 선점 건수를 반환합니다.")
    @GetMapping("/api/access-tiers/{accessTierId}/stock")
    public ResponseEntity<StockStatusResponse> getStock(@PathVariable long accessTierId) {
        return ResponseEntity.ok(StockStatusResponse.from(getStockStatusUseCase.getStockStatus(accessTierId)));
    }
}
