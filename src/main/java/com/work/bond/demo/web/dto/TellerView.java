package com.work.bond.demo.web.dto;

import java.math.BigInteger;

/**
 * teller 快照；条款未设置时 terms、capacity、price 等为 null。
 */
public class TellerView {

    private String address;

    private String name;

    private String state;

    private String principal;

    private boolean permittable;

    private String governance;

    private int protocolFeeBps;

    private TermsView terms;

    private BigInteger capacity;

    private BigInteger price;

    private BigInteger nextPrice;

    private Long lastPriceUpdate;

    private long numBonds;

    public String getAddress() {
        return address;
    }

    public void setAddress(String address) {
        this.address = address;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getState() {
        return state;
    }

    public void setState(String state) {
        this.state = state;
    }

    public String getPrincipal() {
        return principal;
    }

    public void setPrincipal(String principal) {
        this.principal = principal;
    }

    public boolean isPermittable() {
        return permittable;
    }

    public void setPermittable(boolean permittable) {
        this.permittable = permittable;
    }

    public String getGovernance() {
        return governance;
    }

    public void setGovernance(String governance) {
        this.governance = governance;
    }

    public int getProtocolFeeBps() {
        return protocolFeeBps;
    }

    public void setProtocolFeeBps(int protocolFeeBps) {
        this.protocolFeeBps = protocolFeeBps;
    }

    public TermsView getTerms() {
        return terms;
    }

    public void setTerms(TermsView terms) {
        this.terms = terms;
    }

    public BigInteger getCapacity() {
        return capacity;
    }

    public void setCapacity(BigInteger capacity) {
        this.capacity = capacity;
    }

    public BigInteger getPrice() {
        return price;
    }

    public void setPrice(BigInteger price) {
        this.price = price;
    }

    public BigInteger getNextPrice() {
        return nextPrice;
    }

    public void setNextPrice(BigInteger nextPrice) {
        this.nextPrice = nextPrice;
    }

    public Long getLastPriceUpdate() {
        return lastPriceUpdate;
    }

    public void setLastPriceUpdate(Long lastPriceUpdate) {
        this.lastPriceUpdate = lastPriceUpdate;
    }

    public long getNumBonds() {
        return numBonds;
    }

    public void setNumBonds(long numBonds) {
        this.numBonds = numBonds;
    }
}
