package com.example.billinghook.service.notify;

/**
 * 开通通知邮件的收件信息。
 *
 * @param email             收件邮箱（即登录邮箱）
 * @param fullName          收件人姓名，可为空
 * @param temporaryPassword 新账户的临时密码；已有账户为空
 * @param companyName       公司名称，可为空
 */
public record AccessEmail(String email, String fullName, String temporaryPassword, String companyName) {

    @Override
    public String toString() {
        return "AccessEmail[email=" + email + ", newLogin=" + (temporaryPassword != null) + "]";
    }
}
