package com.example.billinghook.service.resolve;

import com.example.billinghook.model.CheckoutSession;
import com.example.billinghook.model.Company;
import com.example.billinghook.model.CompanyUser;
import com.example.billinghook.model.Profile;
import com.example.billinghook.model.Subscription;
import com.example.billinghook.repository.CompanyRepository;
import com.example.billinghook.repository.CompanyUserRepository;
import com.example.billinghook.repository.ProfileRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 公司解析。依次尝试：结账会话绑定的公司、事件中显式的公司 ID、已关联该网关订阅的公司、
 * 用户档案中的公司、邮箱匹配、用户拥有的公司、用户所属的公司；都未命中时新建。
 */
@Component
@Slf4j
public class CompanyResolver {

    static final String DEFAULT_COMPANY_NAME = "Empresa";

    private final CompanyRepository companyRepository;
    private final SlugGenerator slugGenerator;
    private final FirstMatch<ResolutionContext, Company> chain;

    public CompanyResolver(CompanyRepository companyRepository, CompanyUserRepository companyUserRepository,
            ProfileRepository profileRepository, SlugGenerator slugGenerator) {
        this.companyRepository = companyRepository;
        this.slugGenerator = slugGenerator;
        this.chain = FirstMatch.<ResolutionContext, Company>of("company")
                .then("checkout", ctx -> Optional.ofNullable(ctx.getCheckout())
                        .map(CheckoutSession::getCompanyId)
                        .flatMap(companyRepository::findById))
                .then("payload-company-id", ctx -> Optional.ofNullable(ctx.getPayload().getCompanyId())
                        .flatMap(companyRepository::findById))
                .then("existing-subscription", ctx -> Optional.ofNullable(ctx.getExistingSubscription())
                        .map(Subscription::getCompanyId)
                        .flatMap(companyRepository::findById))
                .then("profile", ctx -> profileRepository.findById(ctx.getUserId())
                        .map(Profile::getCompanyId)
                        .flatMap(companyRepository::findById))
                .then("email", ctx -> companyRepository.findFirstByEmailIgnoreCaseOrderByIdAsc(ctx.getEmail()))
                .then("owner", ctx -> companyRepository.findFirstByOwnerUserIdOrderByIdAsc(ctx.getUserId()))
                .then("membership", ctx -> companyUserRepository.findFirstByUserIdOrderByIdAsc(ctx.getUserId())
                        .map(CompanyUser::getCompanyId)
                        .flatMap(companyRepository::findById))
                .build();
    }

    /**
     * 解析或创建公司，结果写入上下文。需要先解析出用户。
     */
    public void resolve(ResolutionContext ctx) {
        Optional<Company> existing = chain.resolve(ctx);
        if (existing.isPresent()) {
            ctx.setCompany(existing.get());
            return;
        }

        String name = nameCandidate(ctx);
        Company company = companyRepository.saveAndFlush(Company.builder()
                .name(name)
                .slug(slugGenerator.uniqueSlug(name))
                .email(ctx.getEmail())
                .phone(ctx.getPayload().getCustomerPhone())
                .ownerUserId(ctx.getUserId())
                .build());
        log.info("Created company {} ({}) for {}", company.getId(), company.getSlug(), ctx.getEmail());
        ctx.setCompany(company);
        ctx.setCompanyCreated(true);
    }

    static String nameCandidate(ResolutionContext ctx) {
        String hint = ctx.getCompanyNameHint();
        if (hint != null && !hint.isBlank()) {
            return hint.trim();
        }
        String customerName = ctx.getPayload().getCustomerName();
        if (customerName != null && !customerName.isBlank()) {
            return customerName.trim();
        }
        String email = ctx.getEmail();
        if (email != null && email.indexOf('@') > 0) {
            return email.substring(0, email.indexOf('@'));
        }
        return DEFAULT_COMPANY_NAME;
    }
}
