package app.mstudio.render.controller;

import app.mstudio.render.controller.dto.CredentialResponse;
import app.mstudio.render.controller.dto.UpsertCredentialRequest;
import app.mstudio.render.service.ProviderCredentialService;
import jakarta.validation.Valid;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/credentials")
public class CredentialController {

    private final ProviderCredentialService credentialService;

    public CredentialController(ProviderCredentialService credentialService) {
        this.credentialService = credentialService;
    }

    @GetMapping
    public List<CredentialResponse> list(@AuthenticationPrincipal Jwt jwt) {
        return credentialService.list(jwt);
    }

    @GetMapping("/{provider}")
    public CredentialResponse get(@AuthenticationPrincipal Jwt jwt,
                                  @PathVariable String provider) {
        return credentialService.get(jwt, provider);
    }

    @PutMapping("/{provider}")
    public CredentialResponse upsert(@AuthenticationPrincipal Jwt jwt,
                                     @PathVariable String provider,
                                     @Valid @RequestBody UpsertCredentialRequest request) {
        return credentialService.upsert(jwt, provider, request.apiKey());
    }

    @DeleteMapping("/{provider}")
    public CredentialResponse disconnect(@AuthenticationPrincipal Jwt jwt,
                                         @PathVariable String provider) {
        return credentialService.disconnect(jwt, provider);
    }
}
