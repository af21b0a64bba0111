package com.fundermatch.matching.api;

import com.fundermatch.matching.model.CharityProfile;
import com.fundermatch.matching.model.FunderDetail;
import com.fundermatch.matching.model.FunderMatch;
import com.fundermatch.matching.model.MatchRequest;
import com.fundermatch.matching.model.MatchResponse;
import com.fundermatch.matching.service.FunderDetailService;
import com.fundermatch.matching.service.FunderMatchingService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
public class MatchController {
    private final FunderMatchingService matchingService;
    private final FunderDetailService funderDetailService;

    public MatchController(FunderMatchingService matchingService, FunderDetailService funderDetailService) {
        this.matchingService = matchingService;
        this.funderDetailService = funderDetailService;
    }

    @PostMapping("/match")
    public MatchResponse match(@RequestBody(required = false) MatchRequest request) {
        CharityProfile profile = request == null ? null : request.charityProfile();
        if (profile == null || !profile.isIdentified()) {
            throw new IllegalArgumentException("Invalid charity profile: charity_name and reg_charity_number are required");
        }
        List<FunderMatch> matches = matchingService.matchFunders(profile, request.isForceRefresh());
        return new MatchResponse(true, matches, "Found " + matches.size() + " matching funders");
    }

    @GetMapping("/funders/{orgId}")
    public FunderDetail funder(@PathVariable("orgId") String orgId) {
        return funderDetailService.getFunderDetails(orgId);
    }
}
