package com.work.bond.demo.web.dto;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.Pattern;

/**
 * 通过 depository 工厂创建 teller；salt 为空时按 nonce 分配地址，否则走 CREATE2。
 */
public class CreateTellerRequest {

    @NotBlank(message = "name 不能为空")
    private String name;

    @NotBlank(message = "governance 不能为空")
    @Pattern(regexp = "^0x[0-9a-fA-F]{40}$", message = "必须是 0x 开头的 20 字节地址")
    private String governance;

    @NotBlank(message = "principal 不能为空")
    @Pattern(regexp = "^0x[0-9a-fA-F]{40}$", message = "必须是 0x 开头的 20 字节地址")
    private String principal;

    private boolean permittable;

    private String salt;

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getGovernance() {
        return governance;
    }

    public void setGovernance(String governance) {
        this.governance = governance;
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

    public String getSalt() {
        return salt;
    }

    public void setSalt(String salt) {
        this.salt = salt;
    }
}
