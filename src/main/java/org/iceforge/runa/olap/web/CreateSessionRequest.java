package org.iceforge.runa.olap.web;

import jakarta.validation.Valid;

public class CreateSessionRequest {

    /**
     * Starting levels by name or alias; missing ones default to Region / Quarter / Group.
     */
    private String geo;
    private String time;
    private String product;

    /**
     * Applied to every request of the session, typically a year.
     */
    @Valid
    private FilterRequest filter;

    public String getGeo() {
        return geo;
    }

    public void setGeo(String geo) {
        this.geo = geo;
    }

    public String getTime() {
        return time;
    }

    public void setTime(String time) {
        this.time = time;
    }

    public String getProduct() {
        return product;
    }

    public void setProduct(String product) {
        this.product = product;
    }

    public FilterRequest getFilter() {
        return filter;
    }

    public void setFilter(FilterRequest filter) {
        this.filter = filter;
    }
}
