package com.zookies.zkbackend.service.attestation;

import com.zookies.zkbackend.config.PublisherKeyProperties;
import com.zookies.zkbackend.exception.AttestationValidationException;
import com.zookies.zkbackend.exception.CryptographyException;
import com.zookies.zkbackend.model.attestation.PublisherInfo;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Service
public class PublisherKeyService {

    private final PublisherKeyProperties config;

    private final Map<String, AttestationSigner> signers = new ConcurrentHashMap<>();

    public PublisherKeyService(PublisherKeyProperties config) {
        this.config = config;
    }

    @PostConstruct
    public void init() {
        log.info("Load {} publisher signing keys", config.getPublishers().size());
        for (PublisherKeyProperties.Publisher publisher : config.getPublishers()) {
            AttestationSigner signer = new AttestationSigner(publisher.getPrivateKey(), publisher.getDomain());
            signers.put(normalize(publisher.getDomain()), signer);
            if (!validatePublisherKeys(publisher.getDomain())) {
                throw new CryptographyException("Configured public key or address does not match private key for " + publisher.getDomain());
            }
            log.info("Publisher {} signs as {}", publisher.getDomain(), signer.getAddress());
        }
    }

    public AttestationSigner getSigner(String domain) {
        return findSigner(domain)
                .orElseThrow(() -> new AttestationValidationException("Invalid publisher: " + domain));
    }

    public Optional<AttestationSigner> findSigner(String domain) {
        if (domain == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(signers.get(normalize(domain)));
    }

    public Optional<PublisherInfo> findPublisher(String domain) {
        return findSigner(domain).map(this::toInfo);
    }

    public List<PublisherInfo> listPublishers() {
        Collection<AttestationSigner> all = signers.values();
        return all.stream()
                .map(this::toInfo)
                .sorted((a, b) -> a.getDomain().compareTo(b.getDomain()))
                .toList();
    }

    /**
     * Checks that the configured public key and address, where given, are the ones derived from the private key.
     */
    public boolean validatePublisherKeys(String domain) {
        AttestationSigner signer = getSigner(domain);
        PublisherKeyProperties.Publisher configured = config.getPublishers().stream()
                .filter(p -> normalize(p.getDomain()).equals(normalize(domain)))
                .findFirst()
                .orElseThrow(() -> new AttestationValidationException("No keys found for domain: " + domain));

        boolean publicKeyMatches = configured.getPublicKey() == null
                || configured.getPublicKey().equalsIgnoreCase(signer.getPublicKey());
        boolean addressMatches = configured.getAddress() == null
                || configured.getAddress().equalsIgnoreCase(signer.getAddress());
        return publicKeyMatches && addressMatches;
    }

    private PublisherInfo toInfo(AttestationSigner signer) {
        return new PublisherInfo(signer.getPublisherDomain(), signer.getPublicKey(), signer.getAddress());
    }

    private static String normalize(String domain) {
        return domain.trim().toLowerCase(Locale.ROOT);
    }

}
