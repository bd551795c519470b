package org.iceforge.runa.olap.model;

import java.util.Map;

/**
 * Physical layout of the sales star schema. The compiler only reads it; it never creates or checks tables.
 */
public class StarSchemaDef {
    private String factTable;
    private String factAlias;
    private Map<String, JoinDef> joins; // dimension key -> dimension table join
    private String quantityColumn;
    private String revenueColumn;
    private String dateColumn; // full date, used for the warehouse date range
    private String productKeyColumn;
    private String shopKeyColumn;

    public String getFactTable() {
        return factTable;
    }

    public void setFactTable(String factTable) {
        this.factTable = factTable;
    }

    public String getFactAlias() {
        return factAlias;
    }

    public void setFactAlias(String factAlias) {
        this.factAlias = factAlias;
    }

    public Map<String, JoinDef> getJoins() {
        return joins;
    }

    public void setJoins(Map<String, JoinDef> joins) {
        this.joins = joins;
    }

    public String getQuantityColumn() {
        return quantityColumn;
    }

    public void setQuantityColumn(String quantityColumn) {
        this.quantityColumn = quantityColumn;
    }

    public String getRevenueColumn() {
        return revenueColumn;
    }

    public void setRevenueColumn(String revenueColumn) {
        this.revenueColumn = revenueColumn;
    }

    public String getDateColumn() {
        return dateColumn;
    }

    public void setDateColumn(String dateColumn) {
        this.dateColumn = dateColumn;
    }

    public String getProductKeyColumn() {
        return productKeyColumn;
    }

    public void setProductKeyColumn(String productKeyColumn) {
        this.productKeyColumn = productKeyColumn;
    }

    public String getShopKeyColumn() {
        return shopKeyColumn;
    }

    public void setShopKeyColumn(String shopKeyColumn) {
        this.shopKeyColumn = shopKeyColumn;
    }

    public static class JoinDef {
        private String table;
        private String alias;
        private String on; // e.g. f.ShopKey = s.ShopKey

        public String getTable() {
            return table;
        }

        public void setTable(String table) {
            this.table = table;
        }

        public String getAlias() {
            return alias;
        }

        public void setAlias(String alias) {
            this.alias = alias;
        }

        public String getOn() {
            return on;
        }

        public void setOn(String on) {
            this.on = on;
        }
    }
}
