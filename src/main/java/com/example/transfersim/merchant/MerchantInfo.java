package com.example.transfersim.merchant;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class MerchantInfo {
    String merchantId;
    String merchantName;
}
