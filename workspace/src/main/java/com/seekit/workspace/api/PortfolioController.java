package com.seekit.workspace.api;

import com.seekit.workspace.api.dto.PortfolioResponse;
import com.seekit.workspace.service.PortfolioService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

/**
 * GET /freelancers/{id}/portfolio : completed projects, reviews and rating stats.
 */
@RestController
public class PortfolioController {

    private final PortfolioService portfolioService;

    public PortfolioController(PortfolioService portfolioService) {
        this.portfolioService = portfolioService;
    }

    @GetMapping("/freelancers/{id}/portfolio")
    public PortfolioResponse getPortfolio(@PathVariable Long id) {
        return PortfolioResponse.from(portfolioService.getPortfolio(id));
    }
}
