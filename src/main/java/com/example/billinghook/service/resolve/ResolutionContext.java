package com.example.billinghook.service.resolve;

import com.example.billinghook.model.CheckoutSession;
import com.example.billinghook.model.Company;
import com.example.billinghook.model.Plan;
import com.example.billinghook.model.Subscription;
import com.example.billinghook.service.payload.CaktoPayload;
import lombok.Getter;
import lombok.Setter;

/**
 * 一次事件处理过程中逐步解析出的实体。各解析器按顺序读取并填充。
 */
@Getter
@Setter
public class ResolutionContext {

    private final String eventId;
    private final CaktoPayload payload;

    // 已关联到该网关订阅 ID 的订阅行（续费时存在）
    private Subscription existingSubscription;

    private CheckoutSession checkout;
    private Plan plan;
    private String email;

    private Long userId;
    private String temporaryPassword;

    private Company company;
    private boolean companyCreated;

    public ResolutionContext(String eventId, CaktoPayload payload) {
        this.eventId = eventId;
        this.payload = payload;
    }

    public boolean isNewLogin() {
        return temporaryPassword != null;
    }

    public String getGatewaySubscriptionId() {
        return payload.getGatewaySubscriptionId();
    }

    /**
     * 显示名称：结账会话中的姓名优先，其次网关客户名，最后邮箱。
     */
    public String getDisplayName() {
        if (checkout != null && checkout.getFullName() != null && !checkout.getFullName().isBlank()) {
            return checkout.getFullName();
        }
        if (payload.getCustomerName() != null) {
            return payload.getCustomerName();
        }
        return email;
    }

    public String getCompanyNameHint() {
        if (checkout != null && checkout.getCompanyName() != null && !checkout.getCompanyName().isBlank()) {
            return checkout.getCompanyName();
        }
        return payload.getCompanyName();
    }
}
