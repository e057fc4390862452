package com.tfbuilder.tfbuilder_backend.controller;

import com.tfbuilder.tfbuilder_backend.model.dto.BlockDto;
import com.tfbuilder.tfbuilder_backend.model.dto.CanvasDto;
import com.tfbuilder.tfbuilder_backend.model.dto.ParseRequest;
import com.tfbuilder.tfbuilder_backend.model.dto.ParseResponse;
import com.tfbuilder.tfbuilder_backend.service.GenerationResult;
import com.tfbuilder.tfbuilder_backend.service.GenerationService;
import com.tfbuilder.tfbuilder_backend.terraform.ParseResult;
import com.tfbuilder.tfbuilder_backend.terraform.TerraformParser;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Stateless pipeline endpoints; neither touches the live workspace. */
@RestController
@RequestMapping("/api/terraform")
@RequiredArgsConstructor
public class TerraformController {

    private final TerraformParser parser;
    private final GenerationService generationService;

    @PostMapping("/parse")
    public ParseResponse parse(@RequestBody ParseRequest request) {
        ParseResult result = parser.parseAll(request.documents());
        return new ParseResponse(
                parser.convertToNodes(result.resources()).stream().map(BlockDto::from).toList(),
                result.variables(),
                result.error());
    }

    @PostMapping("/generate")
    public GenerationResult generate(@RequestBody CanvasDto canvas) {
        return generationService.generate(canvas);
    }
}
