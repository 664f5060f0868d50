package kr.jemi.zaccess.inventory.application.port.in;

import kr.jemi.zaccess.inventory.domain.AccessTier;

public interface CreateAccessTierUseCase {

    AccessTier create(CreateAccessTierCommand command);
}
