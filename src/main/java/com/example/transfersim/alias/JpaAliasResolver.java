package com.example.transfersim.alias;

import com.example.transfersim.entity.Alias;
import com.example.transfersim.entity.AliasType;
import com.example.transfersim.repository.AliasRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Slf4j
@Component
@RequiredArgsConstructor
public class JpaAliasResolver implements AliasResolver {

    private final AliasRepository aliasRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<ResolvedAlias> findVerifiedAlias(AliasType type, String normalizedValue) {
        Optional<ResolvedAlias> resolved = aliasRepository
                .findFirstByTypeAndNormalizedValueAndActiveTrueAndVerifiedTrue(type, normalizedValue)
                .map(alias -> ResolvedAlias.builder()
                        .userId(alias.getUserId())
                        .bankId(alias.getBankId())
                        .accountId(alias.getAccountId())
                        .build());

        log.debug("Alias lookup: type={}, value={}, found={}", type, normalizedValue, resolved.isPresent());
        return resolved;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<String> findPrimaryAlias(String userId, String bankId) {
        return aliasRepository.findFirstByUserIdAndBankIdAndPrimaryTrueAndActiveTrue(userId, bankId)
                .map(Alias::getValue);
    }
}
