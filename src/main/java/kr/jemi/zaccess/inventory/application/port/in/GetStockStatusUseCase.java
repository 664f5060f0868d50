package kr.jemi.zaccess.inventory.application.port.in;

import kr.jemi.zaccess.inventory.domain.StockStatus;

public interface GetStockStatusUseCase {

    StockStatus getStockStatus(long accessTierId);
}
