package org.iceforge.runa.olap.model;

import java.math.BigDecimal;
import java.time.LocalDate;

public record WarehouseStatistics(BigDecimal totalRevenue,
                                  long totalTransactions,
                                  LocalDate firstDate,
                                  LocalDate lastDate,
                                  long uniqueProducts,
                                  long uniqueShops) {

    public boolean isEmpty() {
        return totalTransactions == 0;
    }
}
