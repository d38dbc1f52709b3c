package com.retail.backoffice.service;

import com.retail.backoffice.model.AppSetting;
import com.retail.backoffice.report.ReportDefaults;
import com.retail.backoffice.repository.AppSettingRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Service
public class SettingsService {

    private final AppSettingRepository appSettingRepository;

    public static final String KEY_COMPANY_NAME = "company_name";
    public static final String KEY_CURRENCY_SYMBOL = "currency_symbol";
    public static final String KEY_LOW_STOCK_THRESHOLD = "low_stock_threshold";

    public static final String DEFAULT_COMPANY_NAME = "Retail Back Office";
    public static final String DEFAULT_CURRENCY_SYMBOL = "₹";

    public SettingsService(AppSettingRepository appSettingRepository) {
        this.appSettingRepository = appSettingRepository;
    }

    public String getCompanyName() {
        return appSettingRepository.findBySettingKey(KEY_COMPANY_NAME)
                .map(AppSetting::getSettingValue)
                .filter(val -> !val.isBlank())
                .orElse(DEFAULT_COMPANY_NAME);
    }

    public String getCurrencySymbol() {
        return appSettingRepository.findBySettingKey(KEY_CURRENCY_SYMBOL)
                .map(AppSetting::getSettingValue)
                .filter(val -> !val.isBlank())
                .orElse(DEFAULT_CURRENCY_SYMBOL);
    }

    public int getLowStockThreshold() {
        return appSettingRepository.findBySettingKey(KEY_LOW_STOCK_THRESHOLD)
                .map(AppSetting::getSettingValue)
                .map(val -> {
                    try {
                        return val.isEmpty() ? ReportDefaults.DEFAULT_LOW_STOCK_THRESHOLD : Integer.parseInt(val.trim());
                    } catch (NumberFormatException e) {
                        return ReportDefaults.DEFAULT_LOW_STOCK_THRESHOLD;
                    }
                })
                .filter(val -> val >= 0)
                .orElse(ReportDefaults.DEFAULT_LOW_STOCK_THRESHOLD);
    }

    @Transactional
    public void updateSetting(String key, String value) {
        Optional<AppSetting> existing = appSettingRepository.findBySettingKey(key);
        if (existing.isPresent()) {
            AppSetting setting = existing.get();
            setting.setSettingValue(value != null ? value : "");
            appSettingRepository.save(setting);
        } else {
            appSettingRepository.save(new AppSetting(key, value != null ? value : ""));
        }
    }
}
